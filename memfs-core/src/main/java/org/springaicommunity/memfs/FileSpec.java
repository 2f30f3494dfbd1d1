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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Declaration of an entry to pre-populate a {@link MemoryFileSystem} with.
 *
 * @param path absolute path of the entry
 * @param content file content, {@code null} for a directory
 * @since 0.1.0
 */
public record FileSpec(String path, byte[] content) {

	public FileSpec {
		Objects.requireNonNull(path, "path cannot be null");
		content = content != null ? content.clone() : null;
	}

	/**
	 * A copy of the file content.
	 * @return the content, or {@code null} for a directory
	 */
	@Override
	public byte[] content() {
		return content != null ? content.clone() : null;
	}

	/**
	 * Declare a regular file with UTF-8 content.
	 * @param path absolute path
	 * @param content file content
	 * @return a new FileSpec
	 */
	public static FileSpec of(String path, String content) {
		return new FileSpec(path, content.getBytes(StandardCharsets.UTF_8));
	}

	public static FileSpec of(String path, byte[] content) {
		return new FileSpec(path, Objects.requireNonNull(content, "content cannot be null"));
	}

	/**
	 * Declare a directory.
	 * @param path absolute path
	 * @return a new FileSpec
	 */
	public static FileSpec directory(String path) {
		return new FileSpec(path, null);
	}

	public boolean isDirectory() {
		return content == null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FileSpec)) {
			return false;
		}
		FileSpec other = (FileSpec) o;
		return path.equals(other.path) && Arrays.equals(content, other.content);
	}

	@Override
	public int hashCode() {
		return 31 * path.hashCode() + Arrays.hashCode(content);
	}

	@Override
	public String toString() {
		return isDirectory() ? "FileSpec[path=" + path + ", directory]"
				: "FileSpec[path=" + path + ", content=" + content.length + " bytes]";
	}

}
