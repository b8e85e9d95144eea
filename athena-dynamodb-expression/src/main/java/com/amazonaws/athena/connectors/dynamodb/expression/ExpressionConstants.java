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
 * Fixed tokens of the DynamoDB expression grammar.
 *
 * @see <a href="https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.html">
 *     https://docs.aws.amazon.com/amazondynamodb/latest/developerguide/Expressions.html</a>
 */
final class ExpressionConstants
{
    private ExpressionConstants() {}

    public static final String NAME_ALIAS_PREFIX = "#";
    public static final String VALUE_ALIAS_PREFIX = ":";

    // Template escapes consumed by ExpressionNode, e.g. "$c = $c"
    public static final char ESCAPE = '$';
    public static final char NAME_ESCAPE = 'n';
    public static final char VALUE_ESCAPE = 'v';
    public static final char CHILD_ESCAPE = 'c';

    public static final String NAME_PLACEHOLDER = "$n";
    public static final String VALUE_PLACEHOLDER = "$v";
    public static final String CHILD_PLACEHOLDER = "$c";

    public static final String BUILD_OPERAND = "BuildOperand";
    public static final String BUILD_TREE = "buildTree";
}
