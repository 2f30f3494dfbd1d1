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

import java.util.Objects;

/**
 * Pre-order, depth-first traversal of a {@link NodeTree}.
 *
 * <p>
 * The start node is visited first. The children of a directory are listed after the
 * directory itself was visited, ascending by canonical path, and each child directory is
 * walked completely before its next sibling. Because the listing happens after the
 * visit, a visitor may detach the directory it is visiting and the walk still reaches
 * its children.
 * </p>
 */
final class DirectoryWalker {

	/**
	 * Internal visitor that receives the node itself.
	 */
	@FunctionalInterface
	interface NodeVisitor {

		WalkAction visit(Node node);

	}

	private final NodeTree tree;

	DirectoryWalker(NodeTree tree) {
		this.tree = tree;
	}

	void walk(Node start, NodeVisitor visitor) {
		walkNode(start, visitor);
	}

	/**
	 * @return false once the walk has to stop entirely
	 */
	private boolean walkNode(Node node, NodeVisitor visitor) {
		WalkAction action = Objects.requireNonNull(visitor.visit(node), "visitor must not return null");
		if (action == WalkAction.SKIP_ALL) {
			return false;
		}
		if (!node.isDirectory() || action == WalkAction.SKIP_SUBTREE) {
			return true;
		}
		for (Node child : tree.children(node)) {
			if (!walkNode(child, visitor)) {
				return false;
			}
		}
		return true;
	}

}
