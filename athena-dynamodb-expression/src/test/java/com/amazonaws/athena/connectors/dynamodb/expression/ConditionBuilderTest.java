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
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.and;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.attributeExists;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.in;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.name;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.not;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.or;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.value;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class ConditionBuilderTest
{
    private static final Logger logger = LoggerFactory.getLogger(ConditionBuilderTest.class);

    private static String render(TreeBuilder treeBuilder)
    {
        return render(treeBuilder, new AliasList());
    }

    private static String render(TreeBuilder treeBuilder, AliasList aliasList)
    {
        return treeBuilder.buildTree().buildExpressionString(aliasList);
    }

    @Test
    public void testComparisons()
    {
        logger.info("testComparisons - enter");

        assertEquals("#0 = :0", render(name("foo").equal(value(5))));
        assertEquals("#0 <> :0", render(name("foo").notEqual(value(5))));
        assertEquals("#0 < :0", render(name("foo").lessThan(value(5))));
        assertEquals("#0 <= :0", render(name("foo").lessThanEqual(value(5))));
        assertEquals("#0 > :0", render(name("foo").greaterThan(value(5))));
        assertEquals("#0 >= :0", render(name("foo").greaterThanEqual(value(5))));
        assertEquals("#0 = #1", render(name("foo").equal(name("bar"))));
        assertEquals(":0 < #0", render(value(5).lessThan(name("foo"))));
        assertEquals("size (#0) > :0", render(name("foo").size().greaterThan(value(10))));

        logger.info("testComparisons - exit");
    }

    @Test
    public void testAndOr()
    {
        logger.info("testAndOr - enter");

        ConditionBuilder foo = name("foo").equal(value(5));
        ConditionBuilder bar = name("bar").lessThan(value(6));
        ConditionBuilder baz = name("baz").attributeExists();

        assertEquals("(#0 = :0) AND (#1 < :1)", render(foo.and(bar)));
        assertEquals("(#0 = :0) OR (#1 < :1)", render(foo.or(bar)));
        assertEquals("(#0 = :0) AND (#1 < :1) AND (attribute_exists (#2))", render(and(foo, bar, baz)));
        assertEquals("(#0 = :0) OR (#1 < :1) OR (attribute_exists (#2))", render(or(foo, bar, baz)));
        assertEquals("((#0 = :0) OR (#1 < :1)) AND (NOT (attribute_exists (#2)))", render(foo.or(bar).and(baz.not())));

        logger.info("testAndOr - exit");
    }

    @Test
    public void testRepeatedNameSharesAlias()
    {
        AliasList aliasList = new AliasList();
        assertEquals("(#0 = :0) OR (#0 = :1)", render(name("foo").equal(value(1)).or(name("foo").equal(value(1))), aliasList));
        assertEquals(ImmutableList.of("foo"), aliasList.getNames());
        assertEquals(2, aliasList.getValues().size());
    }

    @Test
    public void testNot()
    {
        assertEquals("NOT (#0 = :0)", render(not(name("foo").equal(value(5)))));
    }

    @Test
    public void testBetween()
    {
        assertEquals("#0 BETWEEN :0 AND :1", render(name("foo").between(value(1), value(5))));
        // bounds are rendered as given
        assertEquals("#0 BETWEEN :0 AND :1", render(name("foo").between(value(5), value(1))));
    }

    @Test
    public void testIn()
    {
        assertEquals("#0 IN (:0)", render(name("foo").in(value(1))));
        assertEquals("#0 IN (:0, :1, :2)", render(name("foo").in(value(1), value(2), value(3))));
        assertEquals("#0 IN (#1, :0)", render(in(name("foo"), name("bar"), value(1))));
    }

    @Test
    public void testInWithoutCandidates()
    {
        ConditionBuilder subjectOnly = new ConditionBuilder(ImmutableList.of(name("foo")), ImmutableList.of(), ConditionBuilder.ConditionMode.IN);
        InvalidParameterException ex = assertThrows(InvalidParameterException.class, subjectOnly::buildTree);
        assertEquals("buildCondition", ex.getFunctionName());
        assertEquals("ConditionBuilder", ex.getParameterType());

        ConditionBuilder empty = new ConditionBuilder(ImmutableList.of(), ImmutableList.of(), ConditionBuilder.ConditionMode.IN);
        assertThrows(InvalidParameterException.class, empty::buildTree);
    }

    @Test
    public void testFunctions()
    {
        logger.info("testFunctions - enter");

        assertEquals("attribute_exists (#0)", render(attributeExists(name("foo"))));
        assertEquals("attribute_not_exists (#0.#1)", render(name("foo.bar").attributeNotExists()));
        assertEquals("begins_with (#0, :0)", render(name("foo").beginsWith("pre")));
        assertEquals("contains (#0, :0)", render(name("foo").contains("sub")));

        AliasList aliasList = new AliasList();
        assertEquals("attribute_type (#0, :0)", render(name("foo").attributeType(DynamoDBAttributeType.NUMBER), aliasList));
        assertEquals(AttributeValue.builder().s("N").build(), aliasList.getValues().get(0));

        logger.info("testFunctions - exit");
    }

    @Test
    public void testUnsetCondition()
    {
        logger.info("testUnsetCondition - enter");

        UnsetParameterException ex = assertThrows(UnsetParameterException.class, () -> new ConditionBuilder().buildTree());
        assertEquals("buildTree", ex.getFunctionName());
        assertEquals("ConditionBuilder", ex.getParameterType());

        // combining does not validate, building does
        ConditionBuilder nested = name("foo").equal(value(1)).and(new ConditionBuilder());
        assertThrows(UnsetParameterException.class, nested::buildTree);

        UnsetParameterException operand = assertThrows(UnsetParameterException.class,
                () -> name("").equal(value(1)).buildTree());
        assertEquals("NameBuilder", operand.getParameterType());

        logger.info("testUnsetCondition - exit");
    }

    @Test
    public void testBuildersAreImmutable()
    {
        ConditionBuilder foo = name("foo").equal(value(5));
        foo.and(name("bar").equal(value(6)));
        foo.not();

        assertEquals(ConditionBuilder.ConditionMode.EQUAL, foo.getMode());
        assertEquals("#0 = :0", render(foo));
    }
}
