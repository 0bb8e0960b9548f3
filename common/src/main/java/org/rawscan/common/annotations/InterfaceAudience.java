/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rawscan.common.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;

/**
 * This annotation is ported and modified from Apache Hadoop project.
 *
 * Annotation to inform users of a package, class or method's intended audience.
 * Currently the audience can be {@link User}, {@link Developer}, {@link Internal}
 *
 * Public classes that are not marked with this annotation must be
 * considered by default as {@link Internal}.
 */
@InterfaceAudience.User
@InterfaceStability.Evolving
public class InterfaceAudience {
  /**
   * To be used by end user or external system, such as a query engine or catalog
   */
  @Documented
  @Retention(RetentionPolicy.RUNTIME)
  public @interface User { }

  /**
   * To be used by developers who plug in a scan engine or a push down rule
   */
  @Documented
  @Retention(RetentionPolicy.RUNTIME)
  public @interface Developer { }

  /**
   * Only used inside this project
   */
  @Documented
  @Retention(RetentionPolicy.RUNTIME)
  public @interface Internal { }

  private InterfaceAudience() { } // Audience can't exist on its own
}
