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

import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.UnsetParameterException;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.add;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.delete;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.name;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.remove;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.set;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.stringSet;
import static com.amazonaws.athena.connectors.dynamodb.expression.DDBExpressions.value;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class UpdateBuilderTest
{
    private static final Logger logger = LoggerFactory.getLogger(UpdateBuilderTest.class);

    private static String render(UpdateBuilder updateBuilder)
    {
        return updateBuilder.buildTree().buildExpressionString(new AliasList());
    }

    @Test
    public void testSingleActions()
    {
        logger.info("testSingleActions - enter");

        assertEquals("SET #0 = :0\n", render(set(name("foo"), value(5))));
        assertEquals("REMOVE #0\n", render(remove(name("foo"))));
        assertEquals("ADD #0 :0\n", render(add(name("foo"), value(1))));
        assertEquals("DELETE #0 :0\n", render(delete(name("foo"), stringSet(ImmutableList.of("a")))));
        assertEquals("SET #0.#1[2] = :0\n", render(set(name("foo.bar[2]"), value("x"))));

        logger.info("testSingleActions - exit");
    }

    @Test
    public void testActionsOfOneKindAreGrouped()
    {
        UpdateBuilder update = set(name("foo"), value(1))
                .set(name("bar"), value(2))
                .set(name("baz"), value(3));

        assertEquals("SET #0 = :0, #1 = :1, #2 = :2\n", render(update));
        assertEquals("REMOVE #0, #1\n", render(remove(name("foo")).remove(name("bar"))));
    }

    @Test
    public void testClauseOrderIgnoresInsertionOrder()
    {
        logger.info("testClauseOrderIgnoresInsertionOrder - enter");

        UpdateBuilder update = delete(name("d"), stringSet(ImmutableList.of("x")))
                .add(name("c"), value(1))
                .remove(name("b"))
                .set(name("a"), value(2));

        assertEquals("SET #0 = :0\nREMOVE #1\nADD #2 :1\nDELETE #3 :2\n", render(update));

        logger.info("testClauseOrderIgnoresInsertionOrder - exit");
    }

    @Test
    public void testSetValueOperands()
    {
        assertEquals("SET #0 = #0 + :0\n", render(set(name("foo"), name("foo").plus(value(1)))));
        assertEquals("SET #0 = if_not_exists(#0, :0)\n", render(set(name("foo"), name("foo").ifNotExists(value(0)))));
        assertEquals("SET #0 = list_append(#0, :0)\n",
                render(new UpdateBuilder().set(name("foo"), name("foo").listAppend(DDBExpressions.list(ImmutableList.of(value("a")))))));
        assertEquals("SET #0 = #1\n", render(set(name("foo"), name("bar"))));
    }

    @Test
    public void testUpdatesAreImmutable()
    {
        UpdateBuilder update = set(name("foo"), value(1));
        update.remove(name("bar"));

        assertEquals("SET #0 = :0\n", render(update));
    }

    @Test
    public void testUnsetUpdate()
    {
        UnsetParameterException ex = assertThrows(UnsetParameterException.class, () -> new UpdateBuilder().buildTree());
        assertEquals("buildTree", ex.getFunctionName());
        assertEquals("UpdateBuilder", ex.getParameterType());

        UnsetParameterException unsetValue = assertThrows(UnsetParameterException.class,
                () -> set(name("foo"), new SetValueBuilder()).buildTree());
        assertEquals("SetValueBuilder", unsetValue.getParameterType());

        assertThrows(UnsetParameterException.class, () -> remove(name("foo..bar")).buildTree());
    }
}
