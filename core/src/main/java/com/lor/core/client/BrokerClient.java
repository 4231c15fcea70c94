/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.lor.core.client;

import com.lor.meta.connection.ConnectionDescriptor;

/**
 * Opens broker connections. Implementations may block; callers run
 * {@link #connect(ConnectionDescriptor)} off the logging thread.
 */
public interface BrokerClient {

    /**
     * Connects to the first reachable host of the descriptor
     *
     * @param descriptor the resolved connection parameters
     * @return an open connection
     * @throws Exception if no host could be reached or the broker refused the connection
     */
    BrokerConnection connect(ConnectionDescriptor descriptor) throws Exception;
}
