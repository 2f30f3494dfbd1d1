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
 * Callback for {@link FileSystem#walkDir(String, WalkVisitor)}.
 *
 * <p>
 * For every visited entry the walk passes the canonical path, a metadata view and a
 * {@code null} error. When the walk root itself cannot be resolved the visitor is called
 * exactly once with a {@code null} info and the resolution failure as {@code error}; the
 * visitor decides whether to rethrow it or to let the walk succeed.
 * </p>
 *
 * <pre>{@code
 * fs.walkDir("/src", (path, info, error) -> {
 *     if (error != null) {
 *         throw error;
 *     }
 *     if (info.isDirectory() && path.endsWith("/build")) {
 *         return WalkAction.SKIP_SUBTREE;
 *     }
 *     paths.add(path);
 *     return WalkAction.CONTINUE;
 * });
 * }</pre>
 *
 * <p>
 * Any exception thrown by the visitor aborts the walk and propagates to the caller
 * unchanged.
 * </p>
 */
@FunctionalInterface
public interface WalkVisitor {

	/**
	 * Visit one entry.
	 * @param path canonical path of the entry
	 * @param info metadata of the entry, {@code null} when {@code error} is set
	 * @param error resolution failure of the walk root, otherwise {@code null}
	 * @return how to continue the walk
	 */
	WalkAction visit(String path, FileInfo info, PathException error);

}
