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

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a builder is used in its default, uninitialized state or when a required name or key is empty.
 */
public class UnsetParameterException extends ExpressionException
{
    private final String functionName;
    private final String parameterType;

    public UnsetParameterException(@Nonnull final String functionName, @Nonnull final String parameterType)
    {
        this(functionName, parameterType, String.format("%s error: unset parameter: %s", functionName, parameterType));
    }

    private UnsetParameterException(String functionName, String parameterType, String message)
    {
        super(message, errorDetails(FederationSourceErrorCode.INVALID_INPUT_EXCEPTION, message));
        this.functionName = requireNonNull(functionName, "functionName is null");
        this.parameterType = requireNonNull(parameterType, "parameterType is null");
    }

    /**
     * @return the operation that detected the unset parameter, e.g. BuildOperand or buildTree
     */
    public String getFunctionName()
    {
        return functionName;
    }

    /**
     * @return the builder type that was unset, e.g. NameBuilder or ConditionBuilder
     */
    public String getParameterType()
    {
        return parameterType;
    }
}
