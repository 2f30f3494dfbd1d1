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
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * A file or directory entry of a {@link NodeTree}.
 *
 * <p>
 * Links to the parent and children are node ids resolved through the owning tree.
 * Directories keep their children keyed by canonical path, so iteration order is
 * lexicographic. Content is a single buffer owned by the node; handles only hold a
 * cursor.
 * </p>
 */
final class Node {

	static final long NO_PARENT = -1L;

	/** Largest content a node can hold. */
	static final int MAX_SIZE = Integer.MAX_VALUE - 8;

	private static final byte[] EMPTY = new byte[0];

	private final long id;

	private final boolean directory;

	private final String path;

	private final String name;

	private final long parentId;

	// null for regular files
	private final TreeMap<String, Long> childIds;

	private byte[] content = EMPTY;

	private final int mode;

	private Instant lastModified;

	private Node(long id, boolean directory, String path, String name, long parentId, int mode,
			Instant lastModified) {
		this.id = id;
		this.directory = directory;
		this.path = path;
		this.name = name;
		this.parentId = parentId;
		this.childIds = directory ? new TreeMap<>() : null;
		this.mode = mode;
		this.lastModified = lastModified;
	}

	static Node directory(long id, String path, String name, long parentId, int mode, Instant lastModified) {
		return new Node(id, true, path, name, parentId, mode, lastModified);
	}

	static Node file(long id, String path, String name, long parentId, int mode, Instant lastModified,
			byte[] content) {
		Node node = new Node(id, false, path, name, parentId, mode, lastModified);
		node.replaceContent(content);
		return node;
	}

	long id() {
		return id;
	}

	boolean isDirectory() {
		return directory;
	}

	String path() {
		return path;
	}

	String name() {
		return name;
	}

	long parentId() {
		return parentId;
	}

	boolean isRoot() {
		return parentId == NO_PARENT;
	}

	/**
	 * Children ids keyed by canonical path. Only {@link NodeTree} mutates this map.
	 */
	Map<String, Long> childIds() {
		if (!directory) {
			throw new IllegalStateException("Regular file has no children: " + path);
		}
		return childIds;
	}

	boolean hasChildren() {
		return directory && !childIds.isEmpty();
	}

	int size() {
		return content.length;
	}

	int mode() {
		return mode;
	}

	Instant lastModified() {
		return lastModified;
	}

	void touch(Instant now) {
		this.lastModified = now;
	}

	byte[] contentCopy() {
		return content.clone();
	}

	void replaceContent(byte[] data) {
		this.content = data.length == 0 ? EMPTY : data.clone();
	}

	/**
	 * Copy content starting at {@code position} into {@code dst}.
	 * @return bytes copied, or -1 if {@code position} is at or past the end
	 */
	int readAt(long position, byte[] dst) {
		if (position >= content.length) {
			return -1;
		}
		int n = (int) Math.min(dst.length, content.length - position);
		System.arraycopy(content, (int) position, dst, 0, n);
		return n;
	}

	/**
	 * Overlay {@code src} at {@code position}, growing the content only as far as needed.
	 * A gap between the current end and {@code position} is zero-filled.
	 */
	void writeAt(long position, byte[] src) {
		long end = position + src.length;
		if (end > content.length) {
			content = Arrays.copyOf(content, (int) end);
		}
		System.arraycopy(src, 0, content, (int) position, src.length);
	}

	/**
	 * Shrink or zero-fill grow to exactly {@code size} bytes.
	 */
	void resize(int size) {
		if (size != content.length) {
			content = size == 0 ? EMPTY : Arrays.copyOf(content, size);
		}
	}

	@Override
	public String toString() {
		return String.format("Node{id=%d, path=%s, directory=%s, size=%d}", id, path, directory, content.length);
	}

}
