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

import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * Permission bit helpers shared by the in-memory engine and the host adapter.
 *
 * <p>
 * Modes are the nine {@code rwxrwxrwx} bits as an {@code int}, written in octal
 * ({@code 0644}). Permissions are stored but never enforced.
 * </p>
 *
 * @since 0.1.0
 */
public final class FileModes {

	/** Default umask on common Linux systems. */
	public static final int DEFAULT_UMASK = 0022;

	/** Requested mode for files created without an explicit mode. */
	public static final int DEFAULT_FILE_MODE = 0666;

	/** Requested mode for directories created without an explicit mode. */
	public static final int DEFAULT_DIRECTORY_MODE = 0777;

	/** All permission bits. */
	public static final int PERMISSION_BITS = 0777;

	// rwx for owner, group, others; index 0 is the highest bit
	private static final PosixFilePermission[] BIT_ORDER = { PosixFilePermission.OWNER_READ,
			PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE, PosixFilePermission.GROUP_READ,
			PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE, PosixFilePermission.OTHERS_READ,
			PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE };

	private FileModes() {
	}

	/**
	 * Clear the umask bits from a requested mode.
	 * @param requested requested permission bits
	 * @param umask bits to clear
	 * @return the effective mode
	 */
	public static int applyUmask(int requested, int umask) {
		return requested & ~umask & PERMISSION_BITS;
	}

	public static Set<PosixFilePermission> toPermissions(int mode) {
		Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
		for (int i = 0; i < BIT_ORDER.length; i++) {
			if ((mode & (0400 >> i)) != 0) {
				permissions.add(BIT_ORDER[i]);
			}
		}
		return permissions;
	}

	public static int fromPermissions(Set<PosixFilePermission> permissions) {
		int mode = 0;
		for (int i = 0; i < BIT_ORDER.length; i++) {
			if (permissions.contains(BIT_ORDER[i])) {
				mode |= 0400 >> i;
			}
		}
		return mode;
	}

	/**
	 * Render a mode the way {@code ls -l} does, e.g. {@code drwxr-xr-x}.
	 * @param mode permission bits
	 * @param directory whether to prefix with {@code d}
	 * @return ten character representation
	 */
	public static String toString(int mode, boolean directory) {
		char[] chars = new char[10];
		chars[0] = directory ? 'd' : '-';
		String rwx = "rwx";
		for (int i = 0; i < 9; i++) {
			chars[i + 1] = (mode & (0400 >> i)) != 0 ? rwx.charAt(i % 3) : '-';
		}
		return new String(chars);
	}

}
