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

import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.InvalidParameterException;
import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.UnsetParameterException;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Optional;

import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.key;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.name;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.namesList;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.remove;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.set;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.value;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;

public class ExpressionTest
{
    private static final Logger logger = LoggerFactory.getLogger(ExpressionTest.class);

    private static AttributeValue number(String value)
    {
        return AttributeValue.builder().n(value).build();
    }

    @Test
    public void testAllKindsShareAliases()
    {
        logger.info("testAllKindsShareAliases - enter");

        Expression expression = Expression.builder()
                .withUpdate(set(name("foo"), value(5)))
                .withKeyCondition(key("foo").equal(value(5)))
                .withProjection(namesList(name("foo"), name("bar"), name("baz")))
                .withFilter(name("bar").lessThan(value(6)))
                .withCondition(name("foo").equal(value(5)))
                .build();

        assertEquals(Optional.of("#0 = :0"), expression.getCondition());
        assertEquals(Optional.of("#1 < :1"), expression.getFilter());
        assertEquals(Optional.of("#0, #1, #2"), expression.getProjection());
        assertEquals(Optional.of("#0 = :2"), expression.getKeyCondition());
        assertEquals(Optional.of("SET #0 = :3\n"), expression.getUpdate());

        assertEquals(Optional.of(ImmutableMap.of("#0", "foo", "#1", "bar", "#2", "baz")), expression.getNames());
        assertEquals(Optional.of(ImmutableMap.of(
                ":0", number("5"),
                ":1", number("6"),
                ":2", number("5"),
                ":3", number("5"))), expression.getValues());

        logger.info("testAllKindsShareAliases - exit");
    }

    @Test
    public void testEmptyBuild()
    {
        Expression expression = Expression.builder().build();

        for (ExpressionType expressionType : ExpressionType.values()) {
            assertFalse(expression.getExpression(expressionType).isPresent());
        }
        assertFalse(expression.getNames().isPresent());
        assertFalse(expression.getValues().isPresent());
    }

    @Test
    public void testProjectionOnlyHasNoValues()
    {
        Expression expression = Expression.builder()
                .withProjection(name("foo").namesList(name("bar")))
                .build();

        assertEquals(Optional.of("#0, #1"), expression.getExpression(ExpressionType.PROJECTION));
        assertEquals(Optional.of(ImmutableMap.of("#0", "foo", "#1", "bar")), expression.getNames());
        assertFalse(expression.getValues().isPresent());
        assertFalse(expression.getCondition().isPresent());
    }

    @Test
    public void testLastBuilderOfAKindWins()
    {
        Expression expression = Expression.builder()
                .withCondition(name("foo").equal(value(1)))
                .withCondition(name("bar").equal(value(2)))
                .build();

        assertEquals(Optional.of("#0 = :0"), expression.getCondition());
        assertEquals(Optional.of(ImmutableMap.of("#0", "bar")), expression.getNames());
        assertEquals(Optional.of(ImmutableMap.of(":0", number("2"))), expression.getValues());
    }

    @Test
    public void testFirstFailureAbortsBuild()
    {
        logger.info("testFirstFailureAbortsBuild - enter");

        Expression.Builder builder = Expression.builder()
                .withProjection(namesList(name("foo")))
                .withCondition(new ConditionBuilder());
        UnsetParameterException ex = assertThrows(UnsetParameterException.class, builder::build);
        assertEquals("ConditionBuilder", ex.getParameterType());

        Expression.Builder invalidKey = Expression.builder()
                .withKeyCondition(key("foo").lessThan(value(1)).and(key("bar").equal(value(2))));
        assertThrows(InvalidParameterException.class, invalidKey::build);

        logger.info("testFirstFailureAbortsBuild - exit");
    }

    @Test
    public void testBuildsAreIndependent()
    {
        Expression.Builder builder = Expression.builder()
                .withCondition(name("foo").attributeExists())
                .withUpdate(remove(name("bar")));

        Expression first = builder.build();
        Expression second = builder.build();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(Optional.of("attribute_exists (#0)"), second.getCondition());
        assertEquals(Optional.of("REMOVE #1\n"), second.getUpdate());
    }
}
