/*-
 * #%L
 * athena-dynamodb-expression
 * %%
 * Copyright (C) 2019 - 2026 Amazon Web Services
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */
package com.amazonaws.athena.connectors.dynamodb.expression.exceptions;

import software.amazon.awssdk.services.glue.model.FederationSourceErrorCode;

import javax.annotation.Nonnull;

import java.util.Optional;

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a builder is structurally present but semantically invalid, such as a key condition that
 * combines two sort key clauses.
 */
public class InvalidParameterException extends ExpressionException
{
    private final String functionName;
    private final String parameterType;
    private final Optional<String> reason;

    public InvalidParameterException(@Nonnull final String functionName, @Nonnull final String parameterType)
    {
        this(functionName, parameterType, null);
    }

    public InvalidParameterException(@Nonnull final String functionName,
                                     @Nonnull final String parameterType,
                                     final String reason)
    {
        super(formatMessage(functionName, parameterType, reason),
                errorDetails(FederationSourceErrorCode.INVALID_INPUT_EXCEPTION, formatMessage(functionName, parameterType, reason)));
        this.functionName = requireNonNull(functionName, "functionName is null");
        this.parameterType = requireNonNull(parameterType, "parameterType is null");
        this.reason = isNullOrEmpty(reason) ? Optional.empty() : Optional.of(reason);
    }

    public String getFunctionName()
    {
        return functionName;
    }

    public String getParameterType()
    {
        return parameterType;
    }

    public Optional<String> getReason()
    {
        return reason;
    }

    private static String formatMessage(String functionName, String parameterType, String reason)
    {
        String message = String.format("%s error: invalid parameter: %s", functionName, parameterType);
        return isNullOrEmpty(reason) ? message : message + ": " + reason;
    }
}
