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
 * POSIX-style error classes reported by {@link PathException}.
 *
 * <p>
 * Callers should branch on the error class rather than on exception messages.
 * </p>
 *
 * @since 0.1.0
 */
public enum Errno {

	/** The path, or a required ancestor, does not exist. */
	ENOENT("no such file or directory"),

	/** An ancestor segment exists but is a regular file. */
	ENOTDIR("not a directory"),

	/** A file-only operation targets a directory. */
	EISDIR("is a directory"),

	/** Exclusive creation was requested against an existing path. */
	EEXIST("file exists"),

	/** A directory that still has children cannot be removed. */
	ENOTEMPTY("directory not empty"),

	/** The operation is never permitted, such as removing the root. */
	EPERM("operation not permitted"),

	/** The host denied access to the path. */
	EACCES("permission denied"),

	/** The handle was not opened for the requested direction. */
	EBADF("bad file descriptor"),

	/** Closed handle, negative offset or otherwise invalid argument. */
	EINVAL("invalid argument");

	private final String description;

	Errno(String description) {
		this.description = description;
	}

	/**
	 * Human readable description, in the wording of the C library.
	 * @return the description
	 */
	public String description() {
		return description;
	}

	@Override
	public String toString() {
		return description;
	}

}
