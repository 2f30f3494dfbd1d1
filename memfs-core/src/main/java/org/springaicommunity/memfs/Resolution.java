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

/**
 * Outcome of {@link PathResolver#resolve(String)}.
 *
 * @param path canonical path
 * @param kind classification against the tree
 * @param node the node for {@link Kind#EXISTS}, otherwise {@code null}
 * @param parent the parent node when it exists, otherwise {@code null}
 * @param directoryMarked whether the raw path ended with a separator
 */
record Resolution(String path, Kind kind, Node node, Node parent, boolean directoryMarked) {

	enum Kind {

		/** A node exists at the path. */
		EXISTS,

		/** The parent is an existing directory and the path itself is free. */
		CREATABLE,

		/** The nearest existing ancestor is a regular file. */
		PARENT_NOT_DIRECTORY,

		/** No ancestor on the way to the path exists. */
		MISSING

	}

	boolean exists() {
		return kind == Kind.EXISTS;
	}

	/**
	 * Whether an operation that needs a regular file must fail with
	 * {@link Errno#EISDIR}: the path is an existing directory, or a creatable path
	 * spelled as a directory. Paths with a missing or non-directory ancestor never
	 * conflict; they report {@link #notFound} instead.
	 */
	boolean isDirectoryConflict() {
		if (exists()) {
			return node.isDirectory();
		}
		return kind == Kind.CREATABLE && directoryMarked;
	}

	/**
	 * The error a non-existing path reports when an existing node was required.
	 */
	PathException notFound(String op, String rawPath) {
		Errno errno = kind == Kind.PARENT_NOT_DIRECTORY ? Errno.ENOTDIR : Errno.ENOENT;
		return new PathException(op, rawPath, errno);
	}

	Node requireExisting(String op, String rawPath) {
		if (!exists()) {
			throw notFound(op, rawPath);
		}
		return node;
	}

}
