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

/**
 * Metadata of a file or directory.
 *
 * <p>
 * In-memory implementations are live views: values reflect the entry at the time of the
 * call, not at the time the view was obtained.
 * </p>
 *
 * @since 0.1.0
 */
public interface FileInfo {

	/**
	 * Base name of the entry; {@code "/"} for the root.
	 * @return the name
	 */
	String name();

	/**
	 * Content length in bytes; 0 for directories.
	 * @return the size
	 */
	long size();

	/**
	 * Permission bits, e.g. {@code 0644}.
	 * @return the mode
	 */
	int mode();

	Instant lastModified();

	boolean isDirectory();

	default boolean isRegularFile() {
		return !isDirectory();
	}

}
