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
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileModes} and {@link OpenFlags}.
 */
class FileModesTest {

	@Test
	void applyUmaskShouldClearMaskedBits() {
		assertThat(FileModes.applyUmask(0666, 0022)).isEqualTo(0644);
		assertThat(FileModes.applyUmask(0777, 0022)).isEqualTo(0755);
		assertThat(FileModes.applyUmask(0600, 0022)).isEqualTo(0600);
		assertThat(FileModes.applyUmask(0640, 0022)).isEqualTo(0640);
		assertThat(FileModes.applyUmask(0666, 0077)).isEqualTo(0600);
		assertThat(FileModes.applyUmask(04777, 0)).isEqualTo(0777);
	}

	@Test
	void permissionsShouldConvertBothWays() {
		assertThat(FileModes.toPermissions(0754)).isEqualTo(PosixFilePermissions.fromString("rwxr-xr--"));
		assertThat(FileModes.toPermissions(0)).isEmpty();
		assertThat(FileModes.fromPermissions(PosixFilePermissions.fromString("rw-r-----"))).isEqualTo(0640);
		assertThat(FileModes.fromPermissions(EnumSet.allOf(PosixFilePermission.class))).isEqualTo(0777);
	}

	@Test
	void modeShouldRenderLikeLs() {
		assertThat(FileModes.toString(0755, true)).isEqualTo("drwxr-xr-x");
		assertThat(FileModes.toString(0640, false)).isEqualTo("-rw-r-----");
		assertThat(FileModes.toString(0, false)).isEqualTo("----------");
	}

	@Test
	void flagsShouldBeTestedAsBitmasks() {
		int flags = OpenFlags.O_WRONLY | OpenFlags.O_CREATE | OpenFlags.O_TRUNC;

		assertThat(OpenFlags.isSet(flags, OpenFlags.O_CREATE)).isTrue();
		assertThat(OpenFlags.isSet(flags, OpenFlags.O_TRUNC)).isTrue();
		assertThat(OpenFlags.isSet(flags, OpenFlags.O_EXCL)).isFalse();
		assertThat(OpenFlags.isSet(flags, OpenFlags.O_APPEND)).isFalse();
		assertThat(OpenFlags.isSet(flags, OpenFlags.O_CREATE | OpenFlags.O_EXCL)).isFalse();
	}

	@Test
	void accessModeShouldDecideDirection() {
		assertThat(OpenFlags.isReadable(OpenFlags.O_RDONLY)).isTrue();
		assertThat(OpenFlags.isWritable(OpenFlags.O_RDONLY)).isFalse();
		assertThat(OpenFlags.isReadable(OpenFlags.O_WRONLY | OpenFlags.O_APPEND)).isFalse();
		assertThat(OpenFlags.isWritable(OpenFlags.O_WRONLY | OpenFlags.O_APPEND)).isTrue();
		assertThat(OpenFlags.isReadable(OpenFlags.O_RDWR)).isTrue();
		assertThat(OpenFlags.isWritable(OpenFlags.O_RDWR)).isTrue();
	}

	@Test
	void flagsShouldRenderSymbolically() {
		assertThat(OpenFlags.toString(OpenFlags.O_RDONLY)).isEqualTo("O_RDONLY");
		assertThat(OpenFlags.toString(OpenFlags.O_RDWR | OpenFlags.O_CREATE | OpenFlags.O_TRUNC))
			.isEqualTo("O_RDWR|O_CREATE|O_TRUNC");
		assertThat(OpenFlags.toString(OpenFlags.O_WRONLY | OpenFlags.O_CREATE | OpenFlags.O_EXCL | OpenFlags.O_APPEND))
			.isEqualTo("O_WRONLY|O_CREATE|O_EXCL|O_APPEND");
	}

}
