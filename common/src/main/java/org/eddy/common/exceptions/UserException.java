/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.eddy.common.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;

/**
 * Base class for all user-visible errors raised while a query runs. The
 * exception carries an {@link ErrorType} that classifies the error, a
 * message meant for the user and a list of context lines that tell the
 * user (and the developer) where the error happened.
 * <p>
 * Eddy does not use checked exceptions. Operators throw a
 * <tt>UserException</tt> when they can explain the problem; the
 * transformation wrappers wrap anything else in an
 * {@link #executionError(Throwable)} so that the error still reaches
 * the driver with a code.
 * <p>
 * Create instances with the builder, for example:<pre><code>
 * throw UserException.failedPreconditionError()
 *     .message("column \"%s\" does not exist", name)
 *     .addContext("Operator", id)
 *     .build(logger);
 * </code></pre>
 */
@SuppressWarnings("serial")
public class UserException extends RuntimeException {

  private final ErrorType errorType;
  private final List<String> context;

  protected UserException(Builder builder) {
    super(builder.message, builder.cause);
    errorType = builder.errorType;
    context = Collections.unmodifiableList(new ArrayList<>(builder.context));
  }

  /**
   * An internal error: a bug, or an inconsistency in the plan given to
   * the engine.
   */
  public static Builder internalError() {
    return new Builder(ErrorType.INTERNAL, null);
  }

  public static Builder internalError(Throwable cause) {
    return new Builder(ErrorType.INTERNAL, cause);
  }

  public static Builder failedPreconditionError() {
    return new Builder(ErrorType.FAILED_PRECONDITION, null);
  }

  public static Builder invalidError() {
    return new Builder(ErrorType.INVALID, null);
  }

  public static Builder invalidError(Throwable cause) {
    return new Builder(ErrorType.INVALID, cause);
  }

  /**
   * Wraps an error raised by user-provided code. If the cause is itself a
   * <tt>UserException</tt>, its type is kept.
   */
  public static Builder inheritError(Throwable cause) {
    ErrorType type = ErrorType.INHERIT;
    if (cause instanceof UserException) {
      type = ((UserException) cause).getErrorType();
    }
    return new Builder(type, cause);
  }

  public static Builder canceledError() {
    return new Builder(ErrorType.CANCELED, null);
  }

  /**
   * Wraps an arbitrary exception thrown while executing an operator. A
   * <tt>UserException</tt> is passed through unchanged by the builder so
   * that the original type and message survive.
   */
  public static Builder executionError(Throwable cause) {
    if (cause instanceof UserException) {
      return new Builder(((UserException) cause).getErrorType(), cause)
          .message(((UserException) cause).getOriginalMessage())
          .addContexts(((UserException) cause).getContext());
    }
    return new Builder(ErrorType.INTERNAL, cause);
  }

  /**
   * Converts any throwable into a <tt>UserException</tt>, returning the
   * throwable itself when it already is one.
   */
  public static UserException wrap(Throwable t, Logger logger) {
    if (t instanceof UserException) {
      return (UserException) t;
    }
    return executionError(t).build(logger);
  }

  public ErrorType getErrorType() { return errorType; }

  public List<String> getContext() { return context; }

  /**
   * The message without context, as seen by the user.
   */
  public String getOriginalMessage() { return super.getMessage(); }

  /**
   * Message plus the context lines, one per line.
   */
  public String getVerboseMessage() {
    StringBuilder buf = new StringBuilder();
    buf.append(errorType.name())
       .append(" ERROR: ")
       .append(getOriginalMessage());
    for (String line : context) {
      buf.append("\n").append(line);
    }
    return buf.toString();
  }

  public static class Builder {

    private final ErrorType errorType;
    private final Throwable cause;
    private final List<String> context = new ArrayList<>();
    private String message;

    protected Builder(ErrorType errorType, Throwable cause) {
      this.errorType = errorType;
      this.cause = cause;
    }

    /**
     * Sets the user message. Only the first call has an effect, which
     * lets an outer layer offer a default message without overwriting a
     * more specific one.
     */
    public Builder message(String format, Object... args) {
      if (message == null) {
        message = args.length == 0 ? format : String.format(format, args);
      }
      return this;
    }

    public Builder addContext(String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(String name, String value) {
      context.add(name + " " + value);
      return this;
    }

    private Builder addContexts(List<String> lines) {
      context.addAll(lines);
      return this;
    }

    public Builder addContext(String name, long value) {
      return addContext(name, Long.toString(value));
    }

    /**
     * Builds the exception and logs it once at error level.
     *
     * @param logger the logger of the class that detected the error
     * @return the exception, which the caller is expected to throw
     */
    public UserException build(Logger logger) {
      if (cause instanceof UserException) {
        UserException ue = (UserException) cause;
        if (ue.getErrorType() == errorType && ue.getContext().equals(context)
            && (message == null || message.equals(ue.getOriginalMessage()))) {
          return ue;
        }
      }
      if (message == null) {
        message = cause == null ? errorType.description()
            : cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
      }
      UserException e = new UserException(this);
      if (errorType == ErrorType.CANCELED) {
        logger.debug(e.getVerboseMessage());
      } else {
        logger.error(e.getVerboseMessage(), cause);
      }
      return e;
    }
  }

  @Override
  public String getMessage() {
    if (context.isEmpty()) {
      return getOriginalMessage();
    }
    return getVerboseMessage();
  }
}
