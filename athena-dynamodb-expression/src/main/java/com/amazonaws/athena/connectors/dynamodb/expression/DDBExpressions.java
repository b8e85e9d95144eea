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

import com.amazonaws.athena.connectors.dynamodb.expression.ConditionBuilder.ConditionMode;
import com.amazonaws.athena.connectors.dynamodb.expression.KeyConditionBuilder.KeyConditionMode;
import com.amazonaws.athena.connectors.dynamodb.expression.SetValueBuilder.SetValueMode;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Entry points for building DynamoDB condition, key condition, projection and update expressions. Intended to
 * be statically imported:
 *
 * <pre>
 * Expression expression = Expression.builder()
 *         .withCondition(name("Price").lessThan(value(100)).and(name("InStock").equal(value(true))))
 *         .withUpdate(set(name("Price"), name("Price").minus(value(5))).remove(name("Discount")))
 *         .build();
 * </pre>
 *
 * Every method returns a new builder and never modifies its arguments.
 */
public final class DDBExpressions
{
    private static final Logger logger = LoggerFactory.getLogger(DDBExpressions.class);

    private DDBExpressions() {}

    // Operands

    /**
     * Creates an attribute path. Dots separate nested attributes and a trailing [n] indexes into a list,
     * e.g. "foo.bar[0].baz".
     */
    public static NameBuilder name(String name)
    {
        return new NameBuilder(name, true);
    }

    /**
     * Creates an attribute name that is used as is, for top level attributes whose name contains a dot or
     * brackets.
     */
    public static NameBuilder nameNoDotSplit(String name)
    {
        return new NameBuilder(name, false);
    }

    public static KeyBuilder key(String key)
    {
        return new KeyBuilder(key);
    }

    public static ValueBuilder value(boolean value)
    {
        return new ValueBuilder(AttributeValue.builder().bool(value).build());
    }

    public static ValueBuilder value(long value)
    {
        return new ValueBuilder(AttributeValue.builder().n(Long.toString(value)).build());
    }

    public static ValueBuilder value(double value)
    {
        return new ValueBuilder(ValueBuilder.numberValue(value));
    }

    public static ValueBuilder value(BigDecimal value)
    {
        requireNonNull(value, "value is null");
        return new ValueBuilder(AttributeValue.builder().n(value.toPlainString()).build());
    }

    public static ValueBuilder value(String value)
    {
        requireNonNull(value, "value is null");
        return new ValueBuilder(AttributeValue.builder().s(value).build());
    }

    public static ValueBuilder value(byte[] value)
    {
        requireNonNull(value, "value is null");
        return new ValueBuilder(AttributeValue.builder().b(SdkBytes.fromByteArray(value)).build());
    }

    public static ValueBuilder value(SdkBytes value)
    {
        requireNonNull(value, "value is null");
        return new ValueBuilder(AttributeValue.builder().b(value).build());
    }

    /**
     * Uses a prepared attribute value as is.
     */
    public static ValueBuilder value(AttributeValue value)
    {
        return new ValueBuilder(value);
    }

    /**
     * Creates a string set value. An empty collection becomes NULL since DynamoDB does not allow empty sets.
     */
    public static ValueBuilder stringSet(Collection<String> value)
    {
        return new ValueBuilder(ValueBuilder.stringSetValue(value));
    }

    /**
     * Creates a list value. An empty list becomes NULL.
     */
    public static ValueBuilder list(List<ValueBuilder> value)
    {
        return new ValueBuilder(ValueBuilder.listValue(value));
    }

    /**
     * Creates a map value. An empty map becomes NULL.
     */
    public static ValueBuilder map(Map<String, ValueBuilder> value)
    {
        return new ValueBuilder(ValueBuilder.mapValue(value));
    }

    /**
     * Converts a plain Java object: null, String, Boolean, Number, byte[], ByteBuffer, SdkBytes, Set, List and Map
     * are supported, recursively for collections. Empty collections become NULL.
     */
    public static ValueBuilder valueOf(Object value)
    {
        return new ValueBuilder(ValueBuilder.toAttributeValue(value));
    }

    public static SizeBuilder size(NameBuilder name)
    {
        return new SizeBuilder(name);
    }

    public static SetValueBuilder plus(OperandBuilder left, OperandBuilder right)
    {
        return new SetValueBuilder(left, right, SetValueMode.PLUS);
    }

    public static SetValueBuilder minus(OperandBuilder left, OperandBuilder right)
    {
        return new SetValueBuilder(left, right, SetValueMode.MINUS);
    }

    public static SetValueBuilder listAppend(OperandBuilder left, OperandBuilder right)
    {
        return new SetValueBuilder(left, right, SetValueMode.LIST_APPEND);
    }

    public static SetValueBuilder ifNotExists(NameBuilder name, OperandBuilder value)
    {
        return new SetValueBuilder(name, value, SetValueMode.IF_NOT_EXISTS);
    }

    // Conditions

    public static ConditionBuilder equal(OperandBuilder left, OperandBuilder right)
    {
        return compare(left, right, ConditionMode.EQUAL);
    }

    public static ConditionBuilder notEqual(OperandBuilder left, OperandBuilder right)
    {
        return compare(left, right, ConditionMode.NOT_EQUAL);
    }

    public static ConditionBuilder lessThan(OperandBuilder left, OperandBuilder right)
    {
        return compare(left, right, ConditionMode.LESS_THAN);
    }

    public static ConditionBuilder lessThanEqual(OperandBuilder left, OperandBuilder right)
    {
        return compare(left, right, ConditionMode.LESS_THAN_EQUAL);
    }

    public static ConditionBuilder greaterThan(OperandBuilder left, OperandBuilder right)
    {
        return compare(left, right, ConditionMode.GREATER_THAN);
    }

    public static ConditionBuilder greaterThanEqual(OperandBuilder left, OperandBuilder right)
    {
        return compare(left, right, ConditionMode.GREATER_THAN_EQUAL);
    }

    private static ConditionBuilder compare(OperandBuilder left, OperandBuilder right, ConditionMode mode)
    {
        return new ConditionBuilder(ImmutableList.of(left, right), ImmutableList.of(), mode);
    }

    public static ConditionBuilder and(ConditionBuilder left, ConditionBuilder right, ConditionBuilder... other)
    {
        return compound(left, right, other, ConditionMode.AND);
    }

    public static ConditionBuilder or(ConditionBuilder left, ConditionBuilder right, ConditionBuilder... other)
    {
        return compound(left, right, other, ConditionMode.OR);
    }

    private static ConditionBuilder compound(ConditionBuilder left, ConditionBuilder right, ConditionBuilder[] other, ConditionMode mode)
    {
        List<ConditionBuilder> conditions = ImmutableList.<ConditionBuilder>builder()
                .add(left)
                .add(right)
                .add(other)
                .build();
        return new ConditionBuilder(ImmutableList.of(), conditions, mode);
    }

    public static ConditionBuilder not(ConditionBuilder condition)
    {
        return new ConditionBuilder(ImmutableList.of(), ImmutableList.of(condition), ConditionMode.NOT);
    }

    public static ConditionBuilder between(OperandBuilder operand, OperandBuilder lower, OperandBuilder upper)
    {
        return new ConditionBuilder(ImmutableList.of(operand, lower, upper), ImmutableList.of(), ConditionMode.BETWEEN);
    }

    public static ConditionBuilder in(OperandBuilder left, OperandBuilder right, OperandBuilder... other)
    {
        List<OperandBuilder> operands = ImmutableList.<OperandBuilder>builder()
                .add(left)
                .add(right)
                .add(other)
                .build();
        return new ConditionBuilder(operands, ImmutableList.of(), ConditionMode.IN);
    }

    public static ConditionBuilder attributeExists(NameBuilder name)
    {
        return new ConditionBuilder(ImmutableList.of(name), ImmutableList.of(), ConditionMode.ATTR_EXISTS);
    }

    public static ConditionBuilder attributeNotExists(NameBuilder name)
    {
        return new ConditionBuilder(ImmutableList.of(name), ImmutableList.of(), ConditionMode.ATTR_NOT_EXISTS);
    }

    public static ConditionBuilder attributeType(NameBuilder name, DynamoDBAttributeType attributeType)
    {
        requireNonNull(attributeType, "attributeType is null");
        return new ConditionBuilder(ImmutableList.of(name, value(attributeType.getCode())), ImmutableList.of(), ConditionMode.ATTR_TYPE);
    }

    public static ConditionBuilder beginsWith(NameBuilder name, String prefix)
    {
        return new ConditionBuilder(ImmutableList.of(name, value(prefix)), ImmutableList.of(), ConditionMode.BEGINS_WITH);
    }

    public static ConditionBuilder contains(NameBuilder name, String substring)
    {
        return new ConditionBuilder(ImmutableList.of(name, value(substring)), ImmutableList.of(), ConditionMode.CONTAINS);
    }

    // Key conditions

    public static KeyConditionBuilder keyEqual(KeyBuilder key, ValueBuilder value)
    {
        return keyCompare(key, value, KeyConditionMode.EQUAL);
    }

    public static KeyConditionBuilder keyLessThan(KeyBuilder key, ValueBuilder value)
    {
        return keyCompare(key, value, KeyConditionMode.LESS_THAN);
    }

    public static KeyConditionBuilder keyLessThanEqual(KeyBuilder key, ValueBuilder value)
    {
        return keyCompare(key, value, KeyConditionMode.LESS_THAN_EQUAL);
    }

    public static KeyConditionBuilder keyGreaterThan(KeyBuilder key, ValueBuilder value)
    {
        return keyCompare(key, value, KeyConditionMode.GREATER_THAN);
    }

    public static KeyConditionBuilder keyGreaterThanEqual(KeyBuilder key, ValueBuilder value)
    {
        return keyCompare(key, value, KeyConditionMode.GREATER_THAN_EQUAL);
    }

    private static KeyConditionBuilder keyCompare(KeyBuilder key, ValueBuilder value, KeyConditionMode mode)
    {
        return new KeyConditionBuilder(ImmutableList.of(key, value), ImmutableList.of(), mode);
    }

    /**
     * Combines a partition key equality with a sort key condition. If the left side is not an equality or the
     * right side is itself an AND, the result is an invalid key condition that fails when it is built.
     */
    public static KeyConditionBuilder keyAnd(KeyConditionBuilder left, KeyConditionBuilder right)
    {
        requireNonNull(left, "left is null");
        requireNonNull(right, "right is null");
        if (left.getMode() != KeyConditionMode.EQUAL) {
            logger.debug("keyAnd: left side is {} rather than EQUAL, marking key condition invalid", left.getMode());
            return KeyConditionBuilder.invalid();
        }
        if (right.getMode() == KeyConditionMode.AND) {
            logger.debug("keyAnd: right side is already an AND, marking key condition invalid");
            return KeyConditionBuilder.invalid();
        }
        return new KeyConditionBuilder(ImmutableList.of(), ImmutableList.of(left, right), KeyConditionMode.AND);
    }

    public static KeyConditionBuilder keyBetween(KeyBuilder key, ValueBuilder lower, ValueBuilder upper)
    {
        return new KeyConditionBuilder(ImmutableList.of(key, lower, upper), ImmutableList.of(), KeyConditionMode.BETWEEN);
    }

    public static KeyConditionBuilder keyBeginsWith(KeyBuilder key, String prefix)
    {
        return new KeyConditionBuilder(ImmutableList.of(key, value(prefix)), ImmutableList.of(), KeyConditionMode.BEGINS_WITH);
    }

    // Projections

    public static ProjectionBuilder namesList(NameBuilder name, NameBuilder... names)
    {
        return new ProjectionBuilder(ImmutableList.<NameBuilder>builder()
                .add(name)
                .add(names)
                .build());
    }

    public static ProjectionBuilder addNames(ProjectionBuilder projection, NameBuilder... names)
    {
        return projection.addNames(names);
    }

    // Updates

    public static UpdateBuilder set(NameBuilder name, OperandBuilder operand)
    {
        return new UpdateBuilder().set(name, operand);
    }

    public static UpdateBuilder remove(NameBuilder name)
    {
        return new UpdateBuilder().remove(name);
    }

    public static UpdateBuilder add(NameBuilder name, ValueBuilder value)
    {
        return new UpdateBuilder().add(name, value);
    }

    public static UpdateBuilder delete(NameBuilder name, ValueBuilder value)
    {
        return new UpdateBuilder().delete(name, value);
    }
}
