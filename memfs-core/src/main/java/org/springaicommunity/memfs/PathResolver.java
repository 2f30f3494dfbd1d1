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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Canonicalises path strings and classifies them against a {@link NodeTree}.
 *
 * <p>
 * Canonical paths are absolute, contain no {@code .} or {@code ..} segments, no repeated
 * separators and no trailing separator except for the root itself. A leading {@code ..}
 * at the root stays at the root. Relative input is taken relative to the root.
 * </p>
 */
final class PathResolver {

	private static final String SEPARATOR = "/";

	private final NodeTree tree;

	PathResolver(NodeTree tree) {
		this.tree = tree;
	}

	static String clean(String path) {
		Deque<String> segments = new ArrayDeque<>();
		for (String segment : path.split(SEPARATOR)) {
			if (segment.isEmpty() || segment.equals(".")) {
				continue;
			}
			if (segment.equals("..")) {
				segments.pollLast();
			}
			else {
				segments.addLast(segment);
			}
		}
		return segments.isEmpty() ? NodeTree.ROOT_PATH : SEPARATOR + String.join(SEPARATOR, segments);
	}

	/**
	 * Segments of a canonical path; empty for the root.
	 */
	static List<String> segments(String canonicalPath) {
		if (canonicalPath.equals(NodeTree.ROOT_PATH)) {
			return List.of();
		}
		return List.of(canonicalPath.substring(1).split(SEPARATOR));
	}

	/**
	 * Parent of a canonical path; the root is its own parent.
	 */
	static String parent(String canonicalPath) {
		int slash = canonicalPath.lastIndexOf('/');
		return slash <= 0 ? NodeTree.ROOT_PATH : canonicalPath.substring(0, slash);
	}

	static String baseName(String canonicalPath) {
		if (canonicalPath.equals(NodeTree.ROOT_PATH)) {
			return NodeTree.ROOT_PATH;
		}
		return canonicalPath.substring(canonicalPath.lastIndexOf('/') + 1);
	}

	/**
	 * Whether the raw path is syntactically a directory, i.e. ends with a separator.
	 * The root is not considered marked.
	 */
	static boolean isDirectoryMarked(String rawPath) {
		return rawPath.endsWith(SEPARATOR) && !clean(rawPath).equals(NodeTree.ROOT_PATH);
	}

	Resolution resolve(String rawPath) {
		Objects.requireNonNull(rawPath, "path cannot be null");
		if (rawPath.isEmpty()) {
			return new Resolution(rawPath, Resolution.Kind.MISSING, null, null, false);
		}
		String path = clean(rawPath);
		boolean marked = isDirectoryMarked(rawPath);

		Node node = tree.lookup(path);
		if (node != null) {
			return new Resolution(path, Resolution.Kind.EXISTS, node, tree.parentOf(node), marked);
		}

		String ancestorPath = parent(path);
		Node parent = tree.lookup(ancestorPath);
		if (parent != null) {
			Resolution.Kind kind = parent.isDirectory() ? Resolution.Kind.CREATABLE
					: Resolution.Kind.PARENT_NOT_DIRECTORY;
			return new Resolution(path, kind, null, parent, marked);
		}

		// the root always exists, so this terminates
		while (true) {
			ancestorPath = parent(ancestorPath);
			Node ancestor = tree.lookup(ancestorPath);
			if (ancestor != null) {
				Resolution.Kind kind = ancestor.isDirectory() ? Resolution.Kind.MISSING
						: Resolution.Kind.PARENT_NOT_DIRECTORY;
				return new Resolution(path, kind, null, null, marked);
			}
		}
	}

}
