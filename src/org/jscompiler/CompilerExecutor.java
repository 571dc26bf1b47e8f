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

package org.jscompiler;

import static com.google.common.base.Throwables.throwIfUnchecked;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a compilation on a thread of its own with a larger stack. The parser, the traversals and the
 * printer recurse once per level of nesting of the AST, so a long chain of binary operators needs a
 * deep stack.
 */
class CompilerExecutor {
  static final long COMPILER_STACK_SIZE = 1L << 26; // About 64MB

  private static ExecutorService newExecutorService() {
    return Executors.newSingleThreadExecutor(
        r -> {
          Thread t = new Thread(null, r, "jscompiler", COMPILER_STACK_SIZE);
          t.setDaemon(true); // Do not prevent the JVM from exiting.
          return t;
        });
  }

  /**
   * Runs {@code callable} on a compiler thread and waits for its result. Unchecked exceptions and
   * errors thrown by the callable are rethrown as they are.
   */
  <T> T runInCompilerThread(Callable<T> callable) {
    ExecutorService executor = newExecutorService();
    try {
      Future<T> future = executor.submit(callable);
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      throwIfUnchecked(cause);
      throw new IllegalStateException(cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while compiling", e);
    } finally {
      executor.shutdown();
    }
  }
}
