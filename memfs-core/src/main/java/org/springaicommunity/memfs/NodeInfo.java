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
 * Live {@link FileInfo} view of a {@link Node}.
 */
final class NodeInfo implements FileInfo {

	private final Node node;

	NodeInfo(Node node) {
		this.node = node;
	}

	@Override
	public String name() {
		return node.name();
	}

	@Override
	public long size() {
		return node.size();
	}

	@Override
	public int mode() {
		return node.mode();
	}

	@Override
	public Instant lastModified() {
		return node.lastModified();
	}

	@Override
	public boolean isDirectory() {
		return node.isDirectory();
	}

	@Override
	public String toString() {
		return String.format("%s %d %s %s", FileModes.toString(node.mode(), node.isDirectory()), node.size(),
				node.lastModified(), node.path());
	}

}
