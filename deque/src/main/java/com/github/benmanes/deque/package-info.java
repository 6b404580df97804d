/*
 * Copyright 2026 Ben Manes. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/**
 * This package contains a double-ended queue built on a doubly-linked chain. All variants are
 * created by the static factories on {@link com.github.benmanes.deque.LinkedDeque}.
 * <p>
 * A {@link com.github.benmanes.deque.LinkedDeque#chained() chained} deque allocates a node per
 * element. An {@link com.github.benmanes.deque.LinkedDeque#indexed() indexed} deque stores its
 * nodes as slots in a growable table and links them by index, reusing the slots of removed
 * elements.
 *
 * @author ben.manes@gmail.com (Ben Manes)
 */
@NullMarked
@CheckReturnValue
package com.github.benmanes.deque;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
