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
 * An open handle on a file or directory, with its own cursor and open flags.
 *
 * <p>
 * Handles are single-use: once {@link #close() closed}, every operation fails with
 * {@link Errno#EINVAL}, including a second {@code close()}. Several handles may be open
 * on the same entry; each has a private cursor but they share the content, so a write
 * through one is visible to reads through the others.
 * </p>
 *
 * <pre>{@code
 * try (FileHandle handle = fs.create("/data/out.bin")) {
 *     handle.seek(5, SeekOrigin.START);
 *     handle.write(new byte[] { 1, 2, 3 }); // content is now 8 bytes, 5 leading zeros
 * }
 * }</pre>
 *
 * @since 0.1.0
 * @see FileSystem#openFile(String, int, int)
 */
public interface FileHandle extends AutoCloseable {

	/**
	 * Base name of the entry this handle was opened on.
	 * @return the name
	 */
	String name();

	/**
	 * Current cursor position. May be negative or beyond the end of the content after a
	 * {@link #seek(long, SeekOrigin) seek}.
	 * @return the cursor
	 */
	long position();

	/**
	 * Metadata of the underlying entry.
	 * @return file info
	 * @throws PathException with {@link Errno#EINVAL} if the handle is closed
	 */
	FileInfo stat();

	/**
	 * Read up to {@code buffer.length} bytes at the cursor and advance it.
	 * @param buffer destination
	 * @return number of bytes read, or {@code -1} at end of stream
	 * @throws PathException with {@link Errno#EISDIR} for directories, {@link Errno#EBADF}
	 * for write-only handles, {@link Errno#EINVAL} if closed or the cursor is negative
	 */
	int read(byte[] buffer);

	/**
	 * Write all of {@code buffer} at the cursor and advance it. With
	 * {@link OpenFlags#O_APPEND} the cursor first moves to the end of the content. A
	 * cursor past the end zero-fills the gap.
	 * @param buffer source
	 * @return number of bytes written, always {@code buffer.length}
	 * @throws PathException with {@link Errno#EBADF} for directories and read-only
	 * handles, {@link Errno#EINVAL} if closed or the cursor is negative
	 */
	int write(byte[] buffer);

	/**
	 * Move the cursor. No bounds are enforced here.
	 * @param offset offset relative to {@code origin}
	 * @param origin reference point
	 * @return the new cursor position
	 * @throws PathException with {@link Errno#EINVAL} if the handle is closed
	 */
	long seek(long offset, SeekOrigin origin);

	/**
	 * Close the handle.
	 * @throws PathException with {@link Errno#EINVAL} if already closed
	 */
	@Override
	void close();

}
