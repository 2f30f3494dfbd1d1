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
 * Hierarchical filesystem operations with POSIX-like semantics.
 *
 * <p>
 * Code written against this interface can run on the host filesystem through
 * {@link LocalFileSystem} and be exercised deterministically, without touching disk,
 * through {@link MemoryFileSystem}.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * FileSystem fs = MemoryFileSystem.builder()
 *     .withFile("/etc/app.conf", "key=value")
 *     .withDirectory("/var/log")
 *     .build();
 *
 * fs.writeFile("/var/log/app.log", "started".getBytes(), 0644);
 * byte[] config = fs.readFile("/etc/app.conf");
 * }</pre>
 *
 * <p>
 * Paths are absolute, {@code /}-separated and canonicalised before use ({@code .},
 * {@code ..} and repeated separators are resolved). Every failure is reported as a
 * {@link PathException} carrying the operation, the path as given and an {@link Errno}.
 * </p>
 *
 * @since 0.1.0
 */
public interface FileSystem {

	/**
	 * Create or truncate a regular file and open it read-write.
	 * @param path file path
	 * @return a handle positioned at 0
	 * @throws PathException {@link Errno#EISDIR}, {@link Errno#ENOTDIR},
	 * {@link Errno#ENOENT}
	 */
	FileHandle create(String path);

	/**
	 * Open an existing file or directory read-only.
	 * @param path path to open
	 * @return a handle positioned at 0
	 * @throws PathException {@link Errno#ENOENT}, {@link Errno#ENOTDIR}
	 */
	FileHandle open(String path);

	/**
	 * General open with {@link OpenFlags} and a permission mode used on creation.
	 * @param path file path
	 * @param flags combined {@link OpenFlags}
	 * @param perm permission bits for a newly created file, before the umask
	 * @return a handle positioned at 0
	 * @throws PathException {@link Errno#EISDIR}, {@link Errno#EEXIST},
	 * {@link Errno#ENOENT}, {@link Errno#ENOTDIR}
	 */
	FileHandle openFile(String path, int flags, int perm);

	/**
	 * Metadata of an existing entry.
	 * @param path path to inspect
	 * @return file info
	 * @throws PathException {@link Errno#ENOENT}, {@link Errno#ENOTDIR}
	 */
	FileInfo stat(String path);

	/**
	 * Walk the tree rooted at {@code root} depth-first in pre-order, visiting the entries
	 * of each directory in ascending lexicographic order.
	 * @param root walk root
	 * @param visitor callback; see {@link WalkVisitor} for the protocol
	 */
	void walkDir(String root, WalkVisitor visitor);

	/**
	 * Resize a regular file. Growing zero-fills.
	 * @param path file path
	 * @param size new size in bytes
	 * @throws PathException {@link Errno#EISDIR}, {@link Errno#ENOENT},
	 * {@link Errno#EINVAL} for a negative size
	 */
	void truncate(String path, long size);

	/**
	 * Read the whole content of a regular file.
	 * @param path file path
	 * @return a copy of the content
	 * @throws PathException {@link Errno#EISDIR}, {@link Errno#ENOENT}
	 */
	byte[] readFile(String path);

	/**
	 * Replace the whole content of a file, creating it if its parent directory exists.
	 * @param path file path
	 * @param data new content
	 * @param perm permission bits for a newly created file, before the umask
	 * @throws PathException {@link Errno#EISDIR}, {@link Errno#ENOTDIR},
	 * {@link Errno#ENOENT}
	 */
	void writeFile(String path, byte[] data, int perm);

	/**
	 * Create a single directory.
	 * @param path directory path
	 * @param perm permission bits, before the umask
	 * @throws PathException {@link Errno#EEXIST}, {@link Errno#ENOTDIR},
	 * {@link Errno#ENOENT}
	 */
	void mkdir(String path, int perm);

	/**
	 * Create a directory and any missing ancestors. Succeeds if it already exists.
	 * @param path directory path
	 * @param perm permission bits for every created directory, before the umask
	 * @throws PathException {@link Errno#ENOTDIR} if a segment is a regular file
	 */
	void mkdirAll(String path, int perm);

	/**
	 * Remove a file or an empty directory.
	 * @param path path to remove
	 * @throws PathException {@link Errno#EPERM} for the root, {@link Errno#ENOTEMPTY},
	 * {@link Errno#ENOENT}
	 */
	void remove(String path);

	/**
	 * Remove an entry and everything below it.
	 * @param path path to remove
	 * @throws PathException {@link Errno#EPERM} if the walk reaches the root,
	 * {@link Errno#ENOENT}
	 */
	void removeAll(String path);

}
