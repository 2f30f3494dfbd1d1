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
 * Open-flag vocabulary accepted by {@link FileSystem#openFile(String, int, int)}.
 *
 * <p>
 * Values follow the Linux {@code fcntl.h} encoding. Exactly one access mode
 * ({@link #O_RDONLY}, {@link #O_WRONLY}, {@link #O_RDWR}) is combined with any number of
 * the creation and status flags:
 * </p>
 *
 * <pre>{@code
 * fs.openFile("/log.txt", OpenFlags.O_WRONLY | OpenFlags.O_CREATE | OpenFlags.O_APPEND, 0644);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class OpenFlags {

	public static final int O_RDONLY = 0x0;

	public static final int O_WRONLY = 0x1;

	public static final int O_RDWR = 0x2;

	public static final int O_CREATE = 0x40;

	public static final int O_EXCL = 0x80;

	public static final int O_TRUNC = 0x200;

	public static final int O_APPEND = 0x400;

	/** Mask selecting the access mode bits. */
	public static final int O_ACCMODE = 0x3;

	private OpenFlags() {
	}

	/**
	 * Whether every bit of {@code flag} is set in {@code flags}.
	 * @param flags combined flag set
	 * @param flag flag to test
	 * @return true if present
	 */
	public static boolean isSet(int flags, int flag) {
		return (flags & flag) == flag;
	}

	public static boolean isReadable(int flags) {
		int mode = flags & O_ACCMODE;
		return mode == O_RDONLY || mode == O_RDWR;
	}

	public static boolean isWritable(int flags) {
		int mode = flags & O_ACCMODE;
		return mode == O_WRONLY || mode == O_RDWR;
	}

	/**
	 * Render a flag set as {@code O_RDWR|O_CREATE|O_TRUNC}, for log output.
	 * @param flags combined flag set
	 * @return symbolic representation
	 */
	public static String toString(int flags) {
		StringBuilder sb = new StringBuilder();
		switch (flags & O_ACCMODE) {
			case O_WRONLY -> sb.append("O_WRONLY");
			case O_RDWR -> sb.append("O_RDWR");
			default -> sb.append("O_RDONLY");
		}
		if (isSet(flags, O_CREATE)) {
			sb.append("|O_CREATE");
		}
		if (isSet(flags, O_EXCL)) {
			sb.append("|O_EXCL");
		}
		if (isSet(flags, O_TRUNC)) {
			sb.append("|O_TRUNC");
		}
		if (isSet(flags, O_APPEND)) {
			sb.append("|O_APPEND");
		}
		return sb.toString();
	}

}
