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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileSpec}.
 */
class FileSpecTest {

	@Test
	void specsWithSameContentShouldBeEqual() {
		FileSpec first = FileSpec.of("/a", "x");
		FileSpec second = FileSpec.of("/a", "x".getBytes(StandardCharsets.UTF_8));

		assertThat(first).isEqualTo(second);
		assertThat(first.hashCode()).isEqualTo(second.hashCode());
		assertThat(first).isNotEqualTo(FileSpec.of("/a", "y"));
		assertThat(first).isNotEqualTo(FileSpec.directory("/a"));
		assertThat(FileSpec.directory("/d")).isEqualTo(FileSpec.directory("/d"));
	}

	@Test
	void contentShouldBeCopiedInAndOut() {
		byte[] data = { 1, 2, 3 };
		FileSpec spec = FileSpec.of("/f", data);

		data[0] = 9;
		spec.content()[1] = 9;

		assertThat(spec.content()).containsExactly(1, 2, 3);
	}

	@Test
	void directorySpecShouldHaveNoContent() {
		FileSpec spec = FileSpec.directory("/d");

		assertThat(spec.isDirectory()).isTrue();
		assertThat(spec.content()).isNull();
		assertThat(spec.toString()).isEqualTo("FileSpec[path=/d, directory]");
		assertThat(FileSpec.of("/f", "abc").toString()).isEqualTo("FileSpec[path=/f, content=3 bytes]");
	}

}
