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
 * {@link FileHandle} over a {@link Node} of a {@link MemoryFileSystem}.
 *
 * <p>
 * The handle references the node without owning it: removing the entry from the tree
 * does not invalidate an open handle, which keeps operating on the detached node.
 * </p>
 */
final class MemoryFileHandle implements FileHandle {

	private final Node node;

	private final int flags;

	private long cursor = 0;

	private boolean closed = false;

	MemoryFileHandle(Node node, int flags) {
		this.node = node;
		this.flags = flags;
	}

	@Override
	public String name() {
		return node.name();
	}

	@Override
	public long position() {
		return cursor;
	}

	@Override
	public FileInfo stat() {
		ensureOpen("stat");
		return new NodeInfo(node);
	}

	@Override
	public int read(byte[] buffer) {
		ensureOpen("read");
		if (node.isDirectory()) {
			throw new PathException("read", node.path(), Errno.EISDIR);
		}
		if (!OpenFlags.isReadable(flags)) {
			throw new PathException("read", node.path(), Errno.EBADF);
		}
		if (cursor < 0) {
			throw new PathException("read", node.path(), Errno.EINVAL);
		}
		int n = node.readAt(cursor, buffer);
		if (n > 0) {
			cursor += n;
		}
		return n;
	}

	@Override
	public int write(byte[] buffer) {
		ensureOpen("write");
		if (node.isDirectory() || !OpenFlags.isWritable(flags)) {
			throw new PathException("write", node.path(), Errno.EBADF);
		}
		if (OpenFlags.isSet(flags, OpenFlags.O_APPEND)) {
			cursor = node.size();
		}
		if (cursor < 0 || cursor + buffer.length > Node.MAX_SIZE) {
			throw new PathException("write", node.path(), Errno.EINVAL);
		}
		node.writeAt(cursor, buffer);
		cursor += buffer.length;
		return buffer.length;
	}

	@Override
	public long seek(long offset, SeekOrigin origin) {
		ensureOpen("seek");
		try {
			cursor = switch (origin) {
				case START -> offset;
				case CURRENT -> Math.addExact(cursor, offset);
				case END -> Math.addExact(node.size(), offset);
			};
		}
		catch (ArithmeticException e) {
			throw new PathException("seek", node.path(), Errno.EINVAL, e);
		}
		return cursor;
	}

	@Override
	public void close() {
		if (closed) {
			throw new PathException("close", node.path(), Errno.EINVAL);
		}
		closed = true;
	}

	private void ensureOpen(String op) {
		if (closed) {
			throw new PathException(op, node.path(), Errno.EINVAL);
		}
	}

	@Override
	public String toString() {
		return String.format("MemoryFileHandle{path=%s, flags=%s, position=%d, closed=%s}", node.path(),
				OpenFlags.toString(flags), cursor, closed);
	}

}
