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

import software.amazon.awssdk.services.glue.model.ErrorDetails;
import software.amazon.awssdk.services.glue.model.FederationSourceErrorCode;

import javax.annotation.Nonnull;

import static java.util.Objects.requireNonNull;

/**
 * Base exception for every failure raised while building or rendering a DynamoDB expression.
 *
 * Failures are deterministic functions of the expression tree that was built, so none of them are worth
 * retrying. The attached {@link ErrorDetails} uses one of the following FederationSourceErrorCode values:
 *
 *     InvalidInputException("InvalidInputException") - a builder was unset or given an invalid parameter
 *     InternalServiceException("InternalServiceException") - a tree node's template disagrees with its payload
 */
public class ExpressionException extends RuntimeException
{
    private final ErrorDetails errorDetails;

    public ExpressionException(@Nonnull final String message,
                               @Nonnull final ErrorDetails errorDetails)
    {
        super(message);
        this.errorDetails = requireNonNull(errorDetails);
        requireNonNull(message);
    }

    /**
     * Creates an exception for a tree that cannot be rendered. These point at a bug in how the tree was
     * assembled rather than at bad caller input.
     *
     * @param message the failure message
     */
    public ExpressionException(@Nonnull final String message)
    {
        this(message, errorDetails(FederationSourceErrorCode.INTERNAL_SERVICE_EXCEPTION, message));
    }

    public ErrorDetails getErrorDetails()
    {
        return errorDetails;
    }

    protected static ErrorDetails errorDetails(FederationSourceErrorCode errorCode, String message)
    {
        return ErrorDetails.builder()
                .errorCode(errorCode.toString())
                .errorMessage(message)
                .build();
    }
}
