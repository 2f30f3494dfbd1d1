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

import java.util.Objects;

/**
 * A failed filesystem operation on a specific path.
 *
 * <p>
 * Carries the name of the operation ({@code open}, {@code stat}, {@code remove}, ...),
 * the path exactly as the caller supplied it, and the {@link Errno} class of the
 * failure. The message reads {@code "<op> <path>: <description>"}.
 * </p>
 *
 * <pre>{@code
 * try {
 *     fs.remove("/data");
 * }
 * catch (PathException e) {
 *     if (e.errno() == Errno.ENOTEMPTY) {
 *         fs.removeAll("/data");
 *     }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public class PathException extends FsException {

	private static final long serialVersionUID = 1L;

	private final String op;

	private final String path;

	private final Errno errno;

	public PathException(String op, String path, Errno errno) {
		this(op, path, errno, null);
	}

	public PathException(String op, String path, Errno errno, Throwable cause) {
		super(op + " " + path + ": " + Objects.requireNonNull(errno, "errno cannot be null").description(), cause);
		this.op = op;
		this.path = path;
		this.errno = errno;
	}

	/**
	 * The operation that failed.
	 * @return operation name
	 */
	public String op() {
		return op;
	}

	/**
	 * The offending path as supplied by the caller.
	 * @return the path
	 */
	public String path() {
		return path;
	}

	/**
	 * The error class.
	 * @return the errno
	 */
	public Errno errno() {
		return errno;
	}

}
