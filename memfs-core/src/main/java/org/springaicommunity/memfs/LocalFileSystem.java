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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FileSystem} that forwards every operation to the host filesystem through
 * {@link java.nio.file.Files}.
 *
 * <p>
 * <strong>WARNING:</strong> This implementation provides NO isolation. Paths are
 * canonicalised and resolved beneath a base directory, which defaults to the host root,
 * so {@code new LocalFileSystem()} touches host paths verbatim.
 * </p>
 *
 * <pre>{@code
 * FileSystem fs = new LocalFileSystem(Path.of("/tmp/workspace"));
 * fs.writeFile("/out/report.txt", bytes, 0644); // writes /tmp/workspace/out/report.txt
 * }</pre>
 *
 * <p>
 * Host failures identified by a {@link java.nio.file.FileSystemException} subtype are
 * reported as {@link PathException}; anything else is wrapped in {@link FsException}.
 * The base directory itself can be walked but never removed.
 * </p>
 *
 * @since 0.1.0
 */
public final class LocalFileSystem implements FileSystem {

	private static final Logger logger = LoggerFactory.getLogger(LocalFileSystem.class);

	private final Path root;

	private final boolean posix;

	/**
	 * Creates a LocalFileSystem operating on host paths verbatim.
	 */
	public LocalFileSystem() {
		this(Path.of("/"));
	}

	/**
	 * Creates a LocalFileSystem whose {@code /} is the given base directory.
	 * @param root the base directory
	 */
	public LocalFileSystem(Path root) {
		this.root = Objects.requireNonNull(root, "root cannot be null").toAbsolutePath().normalize();
		this.posix = this.root.getFileSystem().supportedFileAttributeViews().contains("posix");
		logger.warn("LocalFileSystem created - NO ISOLATION PROVIDED. Operations reach the host filesystem under {}",
				this.root);
	}

	/**
	 * The host directory that {@code /} maps to.
	 * @return the base directory
	 */
	public Path root() {
		return root;
	}

	@Override
	public FileHandle create(String path) {
		return openFile(path, OpenFlags.O_RDWR | OpenFlags.O_CREATE | OpenFlags.O_TRUNC, FileModes.DEFAULT_FILE_MODE);
	}

	@Override
	public FileHandle open(String path) {
		Path target = resolve("open", path);
		if (Files.isDirectory(target)) {
			return LocalFileHandle.directory(target, PathResolver.clean(path), posix);
		}
		return openFile(path, OpenFlags.O_RDONLY, 0);
	}

	@Override
	public FileHandle openFile(String path, int flags, int perm) {
		Path target = resolve("open", path);
		if (Files.isDirectory(target)) {
			throw new PathException("open", path, Errno.EISDIR);
		}
		if (PathResolver.isDirectoryMarked(path) && !Files.exists(target)) {
			throw new PathException("open", path, markedErrno(target));
		}

		boolean create = OpenFlags.isSet(flags, OpenFlags.O_CREATE);
		boolean truncate = OpenFlags.isSet(flags, OpenFlags.O_TRUNC);
		Set<OpenOption> options = new HashSet<>();
		if (OpenFlags.isReadable(flags)) {
			options.add(StandardOpenOption.READ);
		}
		// java.nio ignores CREATE and TRUNCATE_EXISTING on read-only channels
		if (OpenFlags.isWritable(flags) || create || truncate) {
			options.add(StandardOpenOption.WRITE);
		}
		if (create && OpenFlags.isSet(flags, OpenFlags.O_EXCL)) {
			options.add(StandardOpenOption.CREATE_NEW);
		}
		else if (create) {
			options.add(StandardOpenOption.CREATE);
		}
		if (truncate) {
			options.add(StandardOpenOption.TRUNCATE_EXISTING);
		}

		try {
			FileChannel channel = FileChannel.open(target, options, permissionAttributes(perm));
			logger.debug("LocalFileSystem opened {} with {}", target, OpenFlags.toString(flags));
			return new LocalFileHandle(target, PathResolver.clean(path), channel, flags, posix);
		}
		catch (IOException e) {
			throw translate("open", path, e);
		}
	}

	@Override
	public FileInfo stat(String path) {
		Path target = resolve("stat", path);
		try {
			return LocalFileInfo.read(target, PathResolver.baseName(PathResolver.clean(path)), posix);
		}
		catch (IOException e) {
			throw translate("stat", path, e);
		}
	}

	@Override
	public void walkDir(String root, WalkVisitor visitor) {
		Objects.requireNonNull(visitor, "visitor cannot be null");
		String canonical = PathResolver.clean(root);
		if (root.isEmpty()) {
			visitor.visit(canonical, null, new PathException("lstat", root, Errno.ENOENT));
			return;
		}
		Path start = resolve("lstat", root);
		if (!Files.exists(start, LinkOption.NOFOLLOW_LINKS)) {
			visitor.visit(canonical, null, new PathException("lstat", root, missingErrno(start)));
			return;
		}
		walk(start, canonical, visitor);
	}

	private boolean walk(Path path, String virtualPath, WalkVisitor visitor) {
		FileInfo info;
		try {
			info = LocalFileInfo.read(path, PathResolver.baseName(virtualPath), posix, LinkOption.NOFOLLOW_LINKS);
		}
		catch (IOException e) {
			throw translate("lstat", virtualPath, e);
		}
		WalkAction action = Objects.requireNonNull(visitor.visit(virtualPath, info, null),
				"visitor must not return null");
		if (action == WalkAction.SKIP_ALL) {
			return false;
		}
		if (!info.isDirectory() || action == WalkAction.SKIP_SUBTREE) {
			return true;
		}
		List<Path> children;
		try (Stream<Path> stream = Files.list(path)) {
			children = stream.sorted(Comparator.comparing(p -> p.getFileName().toString()))
				.collect(Collectors.toList());
		}
		catch (IOException e) {
			throw translate("readdir", virtualPath, e);
		}
		for (Path child : children) {
			String name = child.getFileName().toString();
			String childPath = virtualPath.equals(NodeTree.ROOT_PATH) ? NodeTree.ROOT_PATH + name
					: virtualPath + "/" + name;
			if (!walk(child, childPath, visitor)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public void truncate(String path, long size) {
		Path target = requireExisting("truncate", path);
		if (Files.isDirectory(target)) {
			throw new PathException("truncate", path, Errno.EISDIR);
		}
		if (size < 0) {
			throw new PathException("truncate", path, Errno.EINVAL);
		}
		try (FileChannel channel = FileChannel.open(target, StandardOpenOption.WRITE)) {
			long current = channel.size();
			if (size < current) {
				channel.truncate(size);
			}
			else if (size > current) {
				// the host zero-fills the gap
				channel.write(ByteBuffer.wrap(new byte[1]), size - 1);
			}
		}
		catch (IOException e) {
			throw translate("truncate", path, e);
		}
	}

	@Override
	public byte[] readFile(String path) {
		Path target = requireExisting("open", path);
		if (Files.isDirectory(target)) {
			throw new PathException("read", path, Errno.EISDIR);
		}
		try {
			return Files.readAllBytes(target);
		}
		catch (IOException e) {
			throw translate("read", path, e);
		}
	}

	@Override
	public void writeFile(String path, byte[] data, int perm) {
		Objects.requireNonNull(data, "data cannot be null");
		Path target = resolve("open", path);
		if (Files.isDirectory(target)) {
			throw new PathException("open", path, Errno.EISDIR);
		}
		if (PathResolver.isDirectoryMarked(path) && !Files.exists(target)) {
			throw new PathException("open", path, markedErrno(target));
		}
		try {
			if (!Files.exists(target)) {
				Files.createFile(target, permissionAttributes(perm));
			}
			Files.write(target, data, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
		}
		catch (IOException e) {
			throw translate("open", path, e);
		}
	}

	@Override
	public void mkdir(String path, int perm) {
		Path target = resolve("mkdir", path);
		try {
			Files.createDirectory(target, permissionAttributes(perm));
		}
		catch (IOException e) {
			throw translate("mkdir", path, e);
		}
	}

	@Override
	public void mkdirAll(String path, int perm) {
		Path current = root;
		for (String segment : PathResolver.segments(PathResolver.clean(path))) {
			current = current.resolve(segment);
			if (!Files.exists(current)) {
				try {
					Files.createDirectory(current, permissionAttributes(perm));
				}
				catch (IOException e) {
					throw translate("mkdir", path, e);
				}
			}
			else if (!Files.isDirectory(current)) {
				throw new PathException("mkdir", path, Errno.ENOTDIR);
			}
		}
	}

	@Override
	public void remove(String path) {
		Path target = resolve("remove", path);
		if (target.equals(root)) {
			throw new PathException("remove", path, Errno.EPERM);
		}
		try {
			Files.delete(target);
		}
		catch (IOException e) {
			throw translate("remove", path, e);
		}
	}

	@Override
	public void removeAll(String path) {
		Path target = resolve("remove", path);
		if (target.equals(root)) {
			throw new PathException("remove", path, Errno.EPERM);
		}
		requireExisting("remove", path);
		try {
			if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
				// Walk in reverse order (deepest first) to delete contents before parent
				try (Stream<Path> stream = Files.walk(target)) {
					for (Path p : stream.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
						Files.delete(p);
					}
				}
			}
			else {
				Files.delete(target);
			}
			logger.debug("LocalFileSystem removed {} recursively", target);
		}
		catch (IOException e) {
			throw translate("remove", path, e);
		}
	}

	private Path resolve(String op, String path) {
		Objects.requireNonNull(path, "path cannot be null");
		if (path.isEmpty()) {
			throw new PathException(op, path, Errno.ENOENT);
		}
		String canonical = PathResolver.clean(path);
		return canonical.equals(NodeTree.ROOT_PATH) ? root : root.resolve(canonical.substring(1));
	}

	private Path requireExisting(String op, String path) {
		Path target = resolve(op, path);
		if (!Files.exists(target)) {
			throw new PathException(op, path, missingErrno(target));
		}
		return target;
	}

	/**
	 * Error for a missing path spelled as a directory: {@link Errno#EISDIR} when its
	 * parent is a directory, otherwise the error of the missing ancestor.
	 */
	private Errno markedErrno(Path target) {
		Path parent = target.getParent();
		if (parent != null && Files.isDirectory(parent)) {
			return Errno.EISDIR;
		}
		return missingErrno(target);
	}

	/**
	 * {@link Errno#ENOTDIR} if the nearest existing ancestor is a regular file.
	 */
	private Errno missingErrno(Path target) {
		for (Path p = target.getParent(); p != null && p.startsWith(root); p = p.getParent()) {
			if (Files.exists(p)) {
				return Files.isDirectory(p) ? Errno.ENOENT : Errno.ENOTDIR;
			}
		}
		return Errno.ENOENT;
	}

	private FileAttribute<?>[] permissionAttributes(int perm) {
		if (!posix) {
			return new FileAttribute<?>[0];
		}
		return new FileAttribute<?>[] {
				PosixFilePermissions.asFileAttribute(FileModes.toPermissions(perm & FileModes.PERMISSION_BITS)) };
	}

	/**
	 * Map a host failure onto the {@link Errno} taxonomy where its type identifies it.
	 */
	static FsException translate(String op, String path, IOException e) {
		Errno errno = null;
		if (e instanceof NoSuchFileException) {
			errno = Errno.ENOENT;
		}
		else if (e instanceof FileAlreadyExistsException) {
			errno = Errno.EEXIST;
		}
		else if (e instanceof DirectoryNotEmptyException) {
			errno = Errno.ENOTEMPTY;
		}
		else if (e instanceof NotDirectoryException) {
			errno = Errno.ENOTDIR;
		}
		else if (e instanceof AccessDeniedException) {
			errno = Errno.EACCES;
		}
		else if (e instanceof FileSystemException) {
			String reason = ((FileSystemException) e).getReason();
			if ("Not a directory".equals(reason)) {
				errno = Errno.ENOTDIR;
			}
			else if ("Is a directory".equals(reason)) {
				errno = Errno.EISDIR;
			}
		}
		if (errno != null) {
			return new PathException(op, path, errno, e);
		}
		return new FsException("Failed to " + op + ": " + path, e);
	}

	@Override
	public String toString() {
		return String.format("LocalFileSystem{root=%s, posix=%s}", root, posix);
	}

}
