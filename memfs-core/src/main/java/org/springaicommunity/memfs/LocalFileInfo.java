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
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of host file attributes.
 *
 * @param name base name of the entry
 * @param size size in bytes, 0 for directories
 * @param mode permission bits
 * @param lastModified last modification time
 * @param isDirectory whether the entry is a directory
 */
record LocalFileInfo(String name, long size, int mode, Instant lastModified,
		boolean isDirectory) implements FileInfo {

	LocalFileInfo {
		Objects.requireNonNull(name, "name cannot be null");
		Objects.requireNonNull(lastModified, "lastModified cannot be null");
	}

	/**
	 * Read the attributes of {@code path}, following symbolic links unless
	 * {@link LinkOption#NOFOLLOW_LINKS} is given.
	 */
	static LocalFileInfo read(Path path, String name, boolean posix, LinkOption... options) throws IOException {
		BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class, options);
		boolean directory = attributes.isDirectory();
		int mode;
		if (posix) {
			mode = FileModes.fromPermissions(Files.getPosixFilePermissions(path, options));
		}
		else {
			mode = FileModes.applyUmask(directory ? FileModes.DEFAULT_DIRECTORY_MODE : FileModes.DEFAULT_FILE_MODE,
					FileModes.DEFAULT_UMASK);
		}
		return new LocalFileInfo(name, directory ? 0 : attributes.size(), mode,
				attributes.lastModifiedTime().toInstant(), directory);
	}

}
