/*
 * Copyright 2026 The Closure Compiler Authors.
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

package org.jscompiler.ir;

import org.jspecify.annotations.Nullable;

/**
 * The binding a NAME node is attached to. A bound NAME reads its name from its slot, so renaming
 * the slot renames every reference at once.
 */
public interface StaticSlot {
  /** Returns the current name of the slot. */
  String getName();

  /** Returns the node that declares the slot, or null for an implicit declaration. */
  @Nullable Node getDeclarationNode();
}
