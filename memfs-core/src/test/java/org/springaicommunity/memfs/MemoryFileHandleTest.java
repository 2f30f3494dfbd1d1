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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link MemoryFileHandle}.
 */
class MemoryFileHandleTest {

	private NodeTree tree;

	private Node file;

	@BeforeEach
	void setUp() {
		tree = new NodeTree(0755, Instant.EPOCH);
		file = tree.addFile(tree.root(), "data.bin", 0644, Instant.EPOCH, new byte[] { 1, 2, 3, 4, 5 });
	}

	private static Errno errnoOf(Runnable operation) {
		return catchThrowableOfType(operation::run, PathException.class).errno();
	}

	@Test
	void seekShouldResolveAgainstEachOrigin() {
		MemoryFileHandle handle = new MemoryFileHandle(file, OpenFlags.O_RDONLY);

		assertThat(handle.seek(2, SeekOrigin.START)).isEqualTo(2);
		assertThat(handle.seek(1, SeekOrigin.CURRENT)).isEqualTo(3);
		assertThat(handle.seek(0, SeekOrigin.END)).isEqualTo(5);
		assertThat(handle.seek(10, SeekOrigin.END)).isEqualTo(15);
		assertThat(handle.position()).isEqualTo(15);
	}

	@Test
	void readPastEndShouldReturnEndOfStream() {
		MemoryFileHandle handle = new MemoryFileHandle(file, OpenFlags.O_RDONLY);
		handle.seek(100, SeekOrigin.START);

		assertThat(handle.read(new byte[4])).isEqualTo(-1);
		assertThat(handle.position()).isEqualTo(100);
	}

	@Test
	void emptyBufferShouldReadNothing() {
		MemoryFileHandle handle = new MemoryFileHandle(file, OpenFlags.O_RDONLY);

		assertThat(handle.read(new byte[0])).isZero();
		assertThat(handle.position()).isZero();
	}

	@Test
	void negativeCursorShouldFailOnReadAndWrite() {
		MemoryFileHandle handle = new MemoryFileHandle(file, OpenFlags.O_RDWR);

		assertThat(handle.seek(-1, SeekOrigin.START)).isEqualTo(-1);

		assertThat(errnoOf(() -> handle.read(new byte[1]))).isEqualTo(Errno.EINVAL);
		assertThat(errnoOf(() -> handle.write(new byte[1]))).isEqualTo(Errno.EINVAL);
		assertThat(file.size()).isEqualTo(5);
	}

	@Test
	void seekOverflowShouldFail() {
		MemoryFileHandle handle = new MemoryFileHandle(file, OpenFlags.O_RDONLY);
		handle.seek(Long.MAX_VALUE, SeekOrigin.START);

		assertThat(errnoOf(() -> handle.seek(1, SeekOrigin.CURRENT))).isEqualTo(Errno.EINVAL);
		assertThat(handle.position()).isEqualTo(Long.MAX_VALUE);
	}

	@Test
	void writeBeyondMaximumSizeShouldFail() {
		MemoryFileHandle handle = new MemoryFileHandle(file, OpenFlags.O_WRONLY);
		handle.seek(Node.MAX_SIZE, SeekOrigin.START);

		assertThat(errnoOf(() -> handle.write(new byte[1]))).isEqualTo(Errno.EINVAL);
		assertThat(file.size()).isEqualTo(5);
	}

	@Test
	void appendShouldIgnoreCursor() {
		MemoryFileHandle handle = new MemoryFileHandle(file, OpenFlags.O_WRONLY | OpenFlags.O_APPEND);

		handle.write(new byte[] { 6 });
		handle.seek(0, SeekOrigin.START);
		handle.write(new byte[] { 7 });

		assertThat(file.contentCopy()).containsExactly(1, 2, 3, 4, 5, 6, 7);
		assertThat(handle.position()).isEqualTo(7);
	}

	@Test
	void directoryHandleShouldRejectIo() {
		MemoryFileHandle handle = new MemoryFileHandle(tree.root(), OpenFlags.O_RDONLY);

		assertThat(handle.name()).isEqualTo("/");
		assertThat(handle.stat().isDirectory()).isTrue();
		assertThat(errnoOf(() -> handle.read(new byte[1]))).isEqualTo(Errno.EISDIR);
		assertThat(errnoOf(() -> handle.write(new byte[1]))).isEqualTo(Errno.EBADF);
	}

	@Test
	void statShouldReflectLaterWrites() {
		MemoryFileHandle handle = new MemoryFileHandle(file, OpenFlags.O_RDWR);
		FileInfo info = handle.stat();

		handle.seek(0, SeekOrigin.END);
		handle.write(new byte[3]);

		assertThat(info.size()).isEqualTo(8);
		assertThat(info.toString()).isEqualTo("-rw-r--r-- 8 1970-01-01T00:00:00Z /data.bin");
	}

	@Test
	void closedHandleShouldReportItsState() {
		MemoryFileHandle handle = new MemoryFileHandle(file, OpenFlags.O_RDWR | OpenFlags.O_APPEND);
		handle.close();

		assertThat(handle.toString()).contains("/data.bin", "O_RDWR|O_APPEND", "closed=true");
		PathException e = catchThrowableOfType(handle::close, PathException.class);
		assertThat(e.op()).isEqualTo("close");
		assertThat(e.errno()).isEqualTo(Errno.EINVAL);
	}

}
