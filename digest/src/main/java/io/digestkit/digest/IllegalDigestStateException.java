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
package io.digestkit.digest;

/**
 * An {@link IllegalStateException} which is raised when a {@link Md5Digest} is used out of order: updated,
 * finished or copied after {@link Md5Digest#finish()}, or asked for its {@link Md5Digest#result()} before.
 */
public class IllegalDigestStateException extends IllegalStateException {

    private static final long serialVersionUID = 4632917521946328765L;

    public IllegalDigestStateException() { }

    public IllegalDigestStateException(String message) {
        super(message);
    }

    public IllegalDigestStateException(String message, Throwable cause) {
        super(message, cause);
    }

    public IllegalDigestStateException(Throwable cause) {
        super(cause);
    }
}
