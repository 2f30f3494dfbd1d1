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
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FileSystem} held entirely in memory.
 *
 * <p>
 * Every invariant a kernel would enforce is maintained here: open-flag interactions,
 * error classes, sparse writes, ordered traversal and protection of non-empty
 * directories and of the root. A failing operation never leaves a partial mutation
 * behind.
 * </p>
 *
 * <p>
 * Use the {@link #builder()} to inject a clock and to pre-populate the tree:
 * </p>
 *
 * <pre>{@code
 * MemoryFileSystem fs = MemoryFileSystem.builder()
 *         .clock(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC))
 *         .withFile("/src/Main.java", "public class Main {}")
 *         .withDirectory("/target/classes")
 *         .build();
 * }</pre>
 *
 * <p>
 * Not thread-safe: callers sharing an instance across threads must serialize access.
 * </p>
 *
 * @since 0.1.0
 */
public final class MemoryFileSystem implements FileSystem {

	private static final Logger logger = LoggerFactory.getLogger(MemoryFileSystem.class);

	private final Clock clock;

	private final int umask;

	private final NodeTree tree;

	private final PathResolver resolver;

	private final DirectoryWalker walker;

	/**
	 * Creates an empty filesystem using the system clock and the default umask.
	 */
	public MemoryFileSystem() {
		this(Clock.systemUTC(), FileModes.DEFAULT_UMASK);
	}

	MemoryFileSystem(Clock clock, int umask) {
		this.clock = Objects.requireNonNull(clock, "clock cannot be null");
		this.umask = umask;
		this.tree = new NodeTree(FileModes.applyUmask(FileModes.DEFAULT_DIRECTORY_MODE, umask), clock.instant());
		this.resolver = new PathResolver(tree);
		this.walker = new DirectoryWalker(tree);
	}

	/**
	 * Creates a builder for MemoryFileSystem with fluent configuration.
	 * @return a new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public FileHandle create(String path) {
		return openFile(path, OpenFlags.O_RDWR | OpenFlags.O_CREATE | OpenFlags.O_TRUNC, FileModes.DEFAULT_FILE_MODE);
	}

	@Override
	public FileHandle open(String path) {
		Node node = resolver.resolve(path).requireExisting("open", path);
		return new MemoryFileHandle(node, OpenFlags.O_RDONLY);
	}

	@Override
	public FileHandle openFile(String path, int flags, int perm) {
		Resolution resolution = resolver.resolve(path);
		if (resolution.exists()) {
			Node node = resolution.node();
			if (node.isDirectory()) {
				throw new PathException("open", path, Errno.EISDIR);
			}
			if (OpenFlags.isSet(flags, OpenFlags.O_CREATE) && OpenFlags.isSet(flags, OpenFlags.O_EXCL)) {
				throw new PathException("open", path, Errno.EEXIST);
			}
			if (OpenFlags.isSet(flags, OpenFlags.O_TRUNC)) {
				node.resize(0);
				node.touch(now());
				logger.debug("Truncated {} on open", node.path());
			}
			return new MemoryFileHandle(node, flags);
		}
		if (!OpenFlags.isSet(flags, OpenFlags.O_CREATE)) {
			if (resolution.isDirectoryConflict()) {
				throw new PathException("open", path, Errno.EISDIR);
			}
			throw resolution.notFound("open", path);
		}
		Node node = createFile(resolution, path, perm, new byte[0]);
		return new MemoryFileHandle(node, flags);
	}

	@Override
	public FileInfo stat(String path) {
		return new NodeInfo(resolver.resolve(path).requireExisting("stat", path));
	}

	@Override
	public void walkDir(String root, WalkVisitor visitor) {
		Objects.requireNonNull(visitor, "visitor cannot be null");
		Resolution resolution = resolver.resolve(root);
		if (!resolution.exists()) {
			visitor.visit(PathResolver.clean(root), null, resolution.notFound("lstat", root));
			return;
		}
		walker.walk(resolution.node(), node -> visitor.visit(node.path(), new NodeInfo(node), null));
	}

	@Override
	public void truncate(String path, long size) {
		Node node = resolver.resolve(path).requireExisting("truncate", path);
		if (node.isDirectory()) {
			throw new PathException("truncate", path, Errno.EISDIR);
		}
		if (size < 0 || size > Node.MAX_SIZE) {
			throw new PathException("truncate", path, Errno.EINVAL);
		}
		node.resize((int) size);
		node.touch(now());
		logger.debug("Truncated {} to {} bytes", node.path(), size);
	}

	@Override
	public byte[] readFile(String path) {
		Node node = resolver.resolve(path).requireExisting("open", path);
		if (node.isDirectory()) {
			throw new PathException("read", path, Errno.EISDIR);
		}
		return node.contentCopy();
	}

	@Override
	public void writeFile(String path, byte[] data, int perm) {
		Objects.requireNonNull(data, "data cannot be null");
		Resolution resolution = resolver.resolve(path);
		if (!resolution.exists()) {
			createFile(resolution, path, perm, data);
			return;
		}
		Node node = resolution.node();
		if (node.isDirectory()) {
			throw new PathException("open", path, Errno.EISDIR);
		}
		node.replaceContent(data);
		node.touch(now());
		logger.debug("Replaced content of {} ({} bytes)", node.path(), data.length);
	}

	@Override
	public void mkdir(String path, int perm) {
		Resolution resolution = resolver.resolve(path);
		if (resolution.exists()) {
			throw new PathException("mkdir", path, Errno.EEXIST);
		}
		if (resolution.kind() != Resolution.Kind.CREATABLE) {
			throw resolution.notFound("mkdir", path);
		}
		Node node = tree.addDirectory(resolution.parent(), PathResolver.baseName(resolution.path()),
				FileModes.applyUmask(perm, umask), now());
		logger.debug("Created directory {}", node.path());
	}

	@Override
	public void mkdirAll(String path, int perm) {
		Objects.requireNonNull(path, "path cannot be null");
		Node current = tree.root();
		for (String segment : PathResolver.segments(PathResolver.clean(path))) {
			Node next = tree.lookup(NodeTree.childPath(current, segment));
			if (next == null) {
				next = tree.addDirectory(current, segment, FileModes.applyUmask(perm, umask), now());
				logger.debug("Created directory {}", next.path());
			}
			else if (!next.isDirectory()) {
				throw new PathException("mkdir", path, Errno.ENOTDIR);
			}
			current = next;
		}
	}

	@Override
	public void remove(String path) {
		Node node = resolver.resolve(path).requireExisting("remove", path);
		if (node.isRoot()) {
			throw new PathException("remove", path, Errno.EPERM);
		}
		if (node.hasChildren()) {
			throw new PathException("remove", path, Errno.ENOTEMPTY);
		}
		tree.detach(node);
		logger.debug("Removed {}", node.path());
	}

	@Override
	public void removeAll(String path) {
		Node start = resolver.resolve(path).requireExisting("remove", path);
		walker.walk(start, node -> {
			if (node.isRoot()) {
				throw new PathException("remove", node.path(), Errno.EPERM);
			}
			tree.detach(node);
			return WalkAction.CONTINUE;
		});
		logger.debug("Removed {} recursively", start.path());
	}

	private Node createFile(Resolution resolution, String rawPath, int perm, byte[] content) {
		if (resolution.kind() != Resolution.Kind.CREATABLE) {
			throw resolution.notFound("open", rawPath);
		}
		if (resolution.isDirectoryConflict()) {
			throw new PathException("open", rawPath, Errno.EISDIR);
		}
		Node node = tree.addFile(resolution.parent(), PathResolver.baseName(resolution.path()),
				FileModes.applyUmask(perm, umask), now(), content);
		logger.debug("Created file {} ({} bytes)", node.path(), content.length);
		return node;
	}

	private void populate(FileSpec spec) {
		String path = PathResolver.clean(spec.path());
		if (spec.isDirectory()) {
			mkdirAll(path, FileModes.DEFAULT_DIRECTORY_MODE);
			return;
		}
		mkdirAll(PathResolver.parent(path), FileModes.DEFAULT_DIRECTORY_MODE);
		writeFile(spec.path(), spec.content(), FileModes.DEFAULT_FILE_MODE);
	}

	private Instant now() {
		return clock.instant();
	}

	/**
	 * Number of entries in the tree, root included.
	 * @return entry count
	 */
	public int entryCount() {
		return tree.size();
	}

	/**
	 * Breadth-first dump of the tree, one entry per line: directories as
	 * {@code /path: (Directory)}, files as {@code /path: `content'}.
	 */
	@Override
	public String toString() {
		List<String> lines = new ArrayList<>();
		Deque<Node> queue = new ArrayDeque<>();
		queue.add(tree.root());
		while (!queue.isEmpty()) {
			Node node = queue.poll();
			if (node.isDirectory()) {
				lines.add(node.path() + ": (Directory)");
				queue.addAll(tree.children(node));
			}
			else {
				lines.add(node.path() + ": `" + new String(node.contentCopy(), StandardCharsets.UTF_8) + "'");
			}
		}
		return String.join("\n", lines);
	}

	/**
	 * Builder for creating MemoryFileSystem instances with fluent configuration.
	 * Declarations are applied in order; each creates its missing ancestors with default
	 * directory permissions.
	 */
	public static class Builder {

		private Clock clock = Clock.systemUTC();

		private int umask = FileModes.DEFAULT_UMASK;

		private final List<FileSpec> initialEntries = new ArrayList<>();

		/**
		 * Set the clock used to stamp modification times.
		 * @param clock the clock
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			this.clock = Objects.requireNonNull(clock, "clock cannot be null");
			return this;
		}

		/**
		 * Set the permission bits cleared from every requested mode.
		 * @param umask the umask, e.g. {@code 0022}
		 * @return this builder
		 */
		public Builder umask(int umask) {
			this.umask = umask & FileModes.PERMISSION_BITS;
			return this;
		}

		/**
		 * Add a file to be created when the filesystem is built.
		 * @param path absolute path
		 * @param content UTF-8 file content
		 * @return this builder
		 */
		public Builder withFile(String path, String content) {
			this.initialEntries.add(FileSpec.of(path, content));
			return this;
		}

		public Builder withFile(String path, byte[] content) {
			this.initialEntries.add(FileSpec.of(path, content));
			return this;
		}

		/**
		 * Add a directory, and its ancestors, to be created when the filesystem is built.
		 * @param path absolute path
		 * @return this builder
		 */
		public Builder withDirectory(String path) {
			this.initialEntries.add(FileSpec.directory(path));
			return this;
		}

		/**
		 * Add multiple entries to be created when the filesystem is built.
		 * @param entries list of file specifications
		 * @return this builder
		 */
		public Builder withFiles(List<FileSpec> entries) {
			this.initialEntries.addAll(entries);
			return this;
		}

		/**
		 * Build the MemoryFileSystem instance.
		 * @return a new MemoryFileSystem
		 * @throws PathException if a declaration conflicts with an earlier one
		 */
		public MemoryFileSystem build() {
			MemoryFileSystem fs = new MemoryFileSystem(clock, umask);
			for (FileSpec entry : initialEntries) {
				fs.populate(entry);
			}
			if (!initialEntries.isEmpty()) {
				logger.debug("MemoryFileSystem populated with {} declarations, {} entries", initialEntries.size(),
						fs.entryCount());
			}
			return fs;
		}

	}

}
