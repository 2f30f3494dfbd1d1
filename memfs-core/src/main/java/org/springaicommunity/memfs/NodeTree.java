/*
 * Copyright 2024 Spring AI Community
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.springaicommunity.memfs;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Node storage of a {@link MemoryFileSystem}.
 *
 * <p>
 * Nodes live in an arena addressed by id. The flat path index is the authoritative
 * lookup; a directory's children ids are a second index over the same nodes. Both are
 * only changed together, by {@link #addFile}, {@link #addDirectory} and {@link #detach}.
 * </p>
 *
 * <p>
 * Not thread-safe.
 * </p>
 */
final class NodeTree {

	static final String ROOT_PATH = "/";

	private final Map<Long, Node> arena = new HashMap<>();

	private final Map<String, Long> index = new HashMap<>();

	private final Node root;

	private long nextId = 0;

	NodeTree(int rootMode, Instant now) {
		this.root = Node.directory(nextId++, ROOT_PATH, ROOT_PATH, Node.NO_PARENT, rootMode, now);
		arena.put(root.id(), root);
		index.put(ROOT_PATH, root.id());
	}

	Node root() {
		return root;
	}

	/**
	 * Look up a node by canonical path.
	 * @return the node, or {@code null} if absent
	 */
	Node lookup(String canonicalPath) {
		Long id = index.get(canonicalPath);
		return id != null ? arena.get(id) : null;
	}

	Node parentOf(Node node) {
		return node.isRoot() ? null : arena.get(node.parentId());
	}

	/**
	 * Children of a directory, ascending by canonical path. Children that were detached
	 * in the meantime are skipped.
	 */
	List<Node> children(Node directory) {
		List<Node> children = new ArrayList<>(directory.childIds().size());
		for (Long id : directory.childIds().values()) {
			Node child = arena.get(id);
			if (child != null) {
				children.add(child);
			}
		}
		return children;
	}

	Node addFile(Node parent, String name, int mode, Instant now, byte[] content) {
		String path = childPath(parent, name);
		return attach(parent, Node.file(nextId++, path, name, parent.id(), mode, now, content));
	}

	Node addDirectory(Node parent, String name, int mode, Instant now) {
		String path = childPath(parent, name);
		return attach(parent, Node.directory(nextId++, path, name, parent.id(), mode, now));
	}

	private Node attach(Node parent, Node node) {
		if (!parent.isDirectory()) {
			throw new IllegalStateException("Parent is not a directory: " + parent.path());
		}
		if (index.containsKey(node.path())) {
			throw new IllegalStateException("Path already present: " + node.path());
		}
		arena.put(node.id(), node);
		index.put(node.path(), node.id());
		parent.childIds().put(node.path(), node.id());
		return node;
	}

	/**
	 * Remove a node from the arena, the path index and its parent's children. The
	 * node's own children are left in place so a walk in progress can still reach them.
	 */
	void detach(Node node) {
		if (node.isRoot()) {
			throw new IllegalStateException("Root cannot be detached");
		}
		arena.remove(node.id());
		index.remove(node.path());
		Node parent = arena.get(node.parentId());
		if (parent != null) {
			parent.childIds().remove(node.path());
		}
	}

	/**
	 * Number of attached nodes, root included.
	 */
	int size() {
		return index.size();
	}

	static String childPath(Node parent, String name) {
		return parent.isRoot() ? ROOT_PATH + name : parent.path() + "/" + name;
	}

}
