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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * {@link FileHandle} of a {@link LocalFileSystem}, backed by a {@link FileChannel}.
 *
 * <p>
 * The cursor is kept here and all channel I/O is positional, so seeking to a negative
 * or past-the-end offset behaves as on the in-memory engine. Directory handles have no
 * channel.
 * </p>
 */
final class LocalFileHandle implements FileHandle {

	private final Path file;

	private final String path;

	private final FileChannel channel;

	private final int flags;

	private final boolean posix;

	private long cursor = 0;

	private boolean closed = false;

	LocalFileHandle(Path file, String path, FileChannel channel, int flags, boolean posix) {
		this.file = file;
		this.path = path;
		this.channel = channel;
		this.flags = flags;
		this.posix = posix;
	}

	static LocalFileHandle directory(Path dir, String path, boolean posix) {
		return new LocalFileHandle(dir, path, null, OpenFlags.O_RDONLY, posix);
	}

	@Override
	public String name() {
		return PathResolver.baseName(path);
	}

	@Override
	public long position() {
		return cursor;
	}

	@Override
	public FileInfo stat() {
		ensureOpen("stat");
		try {
			return LocalFileInfo.read(file, name(), posix);
		}
		catch (IOException e) {
			throw LocalFileSystem.translate("stat", path, e);
		}
	}

	@Override
	public int read(byte[] buffer) {
		ensureOpen("read");
		if (channel == null) {
			throw new PathException("read", path, Errno.EISDIR);
		}
		if (!OpenFlags.isReadable(flags)) {
			throw new PathException("read", path, Errno.EBADF);
		}
		if (cursor < 0) {
			throw new PathException("read", path, Errno.EINVAL);
		}
		try {
			int n = channel.read(ByteBuffer.wrap(buffer), cursor);
			if (n > 0) {
				cursor += n;
			}
			return n;
		}
		catch (IOException e) {
			throw LocalFileSystem.translate("read", path, e);
		}
	}

	@Override
	public int write(byte[] buffer) {
		ensureOpen("write");
		if (channel == null || !OpenFlags.isWritable(flags)) {
			throw new PathException("write", path, Errno.EBADF);
		}
		try {
			if (OpenFlags.isSet(flags, OpenFlags.O_APPEND)) {
				cursor = channel.size();
			}
			if (cursor < 0) {
				throw new PathException("write", path, Errno.EINVAL);
			}
			ByteBuffer src = ByteBuffer.wrap(buffer);
			while (src.hasRemaining()) {
				channel.write(src, cursor + src.position());
			}
			cursor += buffer.length;
			return buffer.length;
		}
		catch (IOException e) {
			throw LocalFileSystem.translate("write", path, e);
		}
	}

	@Override
	public long seek(long offset, SeekOrigin origin) {
		ensureOpen("seek");
		try {
			long end = channel != null ? channel.size() : 0;
			cursor = switch (origin) {
				case START -> offset;
				case CURRENT -> Math.addExact(cursor, offset);
				case END -> Math.addExact(end, offset);
			};
			return cursor;
		}
		catch (ArithmeticException e) {
			throw new PathException("seek", path, Errno.EINVAL, e);
		}
		catch (IOException e) {
			throw LocalFileSystem.translate("seek", path, e);
		}
	}

	@Override
	public void close() {
		if (closed) {
			throw new PathException("close", path, Errno.EINVAL);
		}
		closed = true;
		if (channel != null) {
			try {
				channel.close();
			}
			catch (IOException e) {
				throw LocalFileSystem.translate("close", path, e);
			}
		}
	}

	private void ensureOpen(String op) {
		if (closed) {
			throw new PathException(op, path, Errno.EINVAL);
		}
	}

	@Override
	public String toString() {
		return String.format("LocalFileHandle{file=%s, flags=%s, position=%d, closed=%s}", file,
				OpenFlags.toString(flags), cursor, closed);
	}

}
