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
package com.amazonaws.athena.connectors.dynamodb.expression;

/**
 * Attribute types accepted by the attribute_type function, with the type code DynamoDB expects.
 *
 * @see <a href="https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.OperatorsAndFunctions.html">
 *     https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.OperatorsAndFunctions.html</a>
 */
public enum DynamoDBAttributeType
{
    STRING("S"),
    STRING_SET("SS"),
    NUMBER("N"),
    NUMBER_SET("NS"),
    BINARY("B"),
    BINARY_SET("BS"),
    BOOLEAN("BOOL"),
    NULL("NULL"),
    LIST("L"),
    MAP("M");

    private final String code;

    DynamoDBAttributeType(String code)
    {
        this.code = code;
    }

    public String getCode()
    {
        return code;
    }
}
