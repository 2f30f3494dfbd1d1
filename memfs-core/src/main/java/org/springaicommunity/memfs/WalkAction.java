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
 * Result of a {@link WalkVisitor} invocation.
 *
 * <p>
 * Neither skip result is a failure: a walk that ends through {@link #SKIP_ALL} completes
 * normally. To abort a walk with an error, throw from the visitor.
 * </p>
 */
public enum WalkAction {

	/** Keep walking; descend into the entry if it is a directory. */
	CONTINUE,

	/**
	 * Do not descend into the directory just visited and resume with its next sibling.
	 * Has no effect when returned for a regular file.
	 */
	SKIP_SUBTREE,

	/** Stop the whole walk immediately. */
	SKIP_ALL

}
