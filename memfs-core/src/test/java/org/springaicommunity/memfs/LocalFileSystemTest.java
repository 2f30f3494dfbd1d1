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
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assumptions.assumeThat;

/**
 * Tests for behaviour specific to {@link LocalFileSystem}: mapping onto the base
 * directory and translation of host failures.
 */
class LocalFileSystemTest {

	@TempDir
	Path tempDir;

	private LocalFileSystem fs;

	@BeforeEach
	void setUp() {
		fs = new LocalFileSystem(tempDir);
	}

	@Test
	void pathsShouldMapBelowBaseDirectory() throws IOException {
		fs.mkdirAll("/out/reports", 0755);
		fs.writeFile("/out/reports/summary.txt", "done".getBytes(StandardCharsets.UTF_8), 0644);

		assertThat(tempDir.resolve("out/reports/summary.txt")).exists();
		assertThat(Files.readString(tempDir.resolve("out/reports/summary.txt"))).isEqualTo("done");
		assertThat(fs.root()).isEqualTo(tempDir.toAbsolutePath().normalize());
	}

	@Test
	void dotDotShouldNotEscapeBaseDirectory() {
		fs.writeFile("/../../escape.txt", new byte[] { 1 }, 0644);

		assertThat(tempDir.resolve("escape.txt")).exists();
		assertThat(fs.readFile("/escape.txt")).containsExactly(1);
	}

	@Test
	void baseDirectoryShouldStatAsRoot() {
		FileInfo root = fs.stat("/");

		assertThat(root.name()).isEqualTo("/");
		assertThat(root.isDirectory()).isTrue();
	}

	@Test
	void walkShouldReportPathsRelativeToBaseDirectory() throws IOException {
		Files.createDirectories(tempDir.resolve("b/c"));
		Files.writeString(tempDir.resolve("a.txt"), "a");
		List<String> visited = new ArrayList<>();

		fs.walkDir("/", (path, info, error) -> {
			visited.add(path);
			return WalkAction.CONTINUE;
		});

		assertThat(visited).containsExactly("/", "/a.txt", "/b", "/b/c");
	}

	@Test
	void createdEntriesShouldCarryRequestedPermissions() throws IOException {
		assumeThat(tempDir.getFileSystem().supportedFileAttributeViews()).contains("posix");

		fs.writeFile("/secret.txt", new byte[0], 0640);
		fs.mkdir("/private", 0700);

		assertThat(Files.getPosixFilePermissions(tempDir.resolve("secret.txt")))
			.isEqualTo(PosixFilePermissions.fromString("rw-r-----"));
		assertThat(fs.stat("/secret.txt").mode()).isEqualTo(0640);
		assertThat(fs.stat("/private").mode()).isEqualTo(0700);
	}

	@Test
	void statShouldFollowSymbolicLinksButWalkShouldNot() throws IOException {
		assumeThat(tempDir.getFileSystem().supportedFileAttributeViews()).contains("posix");
		Files.createDirectories(tempDir.resolve("real"));
		Files.writeString(tempDir.resolve("real/data.txt"), "abc");
		Files.createSymbolicLink(tempDir.resolve("file-link"), tempDir.resolve("real/data.txt"));
		Files.createSymbolicLink(tempDir.resolve("dir-link"), tempDir.resolve("real"));
		List<String> visited = new ArrayList<>();

		FileInfo fileLink = fs.stat("/file-link");
		FileInfo dirLink = fs.stat("/dir-link");
		fs.walkDir("/", (path, info, error) -> {
			visited.add(path);
			return WalkAction.CONTINUE;
		});

		assertThat(fileLink.name()).isEqualTo("file-link");
		assertThat(fileLink.size()).isEqualTo(3);
		assertThat(fileLink.isRegularFile()).isTrue();
		assertThat(dirLink.isDirectory()).isTrue();
		assertThat(visited).containsExactly("/", "/dir-link", "/file-link", "/real", "/real/data.txt");
	}

	@Test
	void typedHostFailuresShouldTranslateToErrno() {
		NoSuchFileException missing = new NoSuchFileException("/x");

		FsException translated = LocalFileSystem.translate("open", "/x", missing);

		assertThat(translated).isInstanceOf(PathException.class).hasCause(missing);
		assertThat(((PathException) translated).errno()).isEqualTo(Errno.ENOENT);
		assertThat(translated).hasMessage("open /x: no such file or directory");
	}

	@Test
	void hostReasonShouldTranslateToErrno() {
		FsException isDirectory = LocalFileSystem.translate("read", "/d",
				new FileSystemException("/d", null, "Is a directory"));
		FsException notDirectory = LocalFileSystem.translate("stat", "/f/x",
				new FileSystemException("/f/x", null, "Not a directory"));

		assertThat(((PathException) isDirectory).errno()).isEqualTo(Errno.EISDIR);
		assertThat(((PathException) notDirectory).errno()).isEqualTo(Errno.ENOTDIR);
	}

	@Test
	void untypedHostFailureShouldBeWrapped() {
		IOException failure = new IOException("disk on fire");

		FsException translated = LocalFileSystem.translate("write", "/f", failure);

		assertThat(translated).isNotInstanceOf(PathException.class)
			.hasMessage("Failed to write: /f")
			.hasCause(failure);
	}

}
