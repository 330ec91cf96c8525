/*
 * Copyright 2026 The DigestKit Project
 *
 * The DigestKit Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.digestkit.util.internal.logging;

/**
 * <em>Internal-use-only</em> logger used by DigestKit.  <strong>DO NOT</strong>
 * access this class outside of DigestKit.
 * <p>
 * Messages use the <code>{}</code> placeholder syntax of SLF4J. A trailing {@link Throwable}
 * argument is logged as the cause.
 */
public interface InternalLogger {

    /**
     * Return the name of this {@link InternalLogger} instance.
     *
     * @return name of this logger instance
     */
    String name();

    /**
     * Is the logger instance enabled for the DEBUG level?
     *
     * @return True if this Logger is enabled for the DEBUG level,
     *         false otherwise.
     */
    boolean isDebugEnabled();

    /**
     * Log a message at the DEBUG level according to the specified format and
     * argument.
     */
    void debug(String format, Object arg);

    /**
     * Log a message at the DEBUG level according to the specified format and
     * arguments.
     */
    void debug(String format, Object argA, Object argB);

    /**
     * Is the logger instance enabled for the INFO level?
     */
    boolean isInfoEnabled();

    /**
     * Is the logger instance enabled for the WARN level?
     */
    boolean isWarnEnabled();

    void warn(String format, Object argA, Object argB);

    void warn(String format, Object... arguments);
}
