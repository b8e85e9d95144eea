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
import com.google.common.collect.ImmutableList;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.VALUE_PLACEHOLDER;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A literal value. The literal is converted to its {@link AttributeValue} when the builder is created and is
 * aliased as :index when the expression is rendered.
 *
 * DynamoDB rejects empty sets, so empty string sets, lists and maps are converted to a NULL attribute value.
 */
public final class ValueBuilder
        extends AbstractArithmeticOperandBuilder
{
    private static final AttributeValue NULL_VALUE = AttributeValue.builder().nul(true).build();

    private final AttributeValue attributeValue;

    ValueBuilder(AttributeValue attributeValue)
    {
        this.attributeValue = requireNonNull(attributeValue, "attributeValue is null");
    }

    public AttributeValue getAttributeValue()
    {
        return attributeValue;
    }

    @Override
    public Operand buildOperand()
    {
        return new Operand(ExpressionNode.fromValues(ImmutableList.of(attributeValue), VALUE_PLACEHOLDER));
    }

    static AttributeValue numberValue(double value)
    {
        checkArgument(Double.isFinite(value), "DynamoDB numbers must be finite but was %s", value);
        return AttributeValue.builder().n(BigDecimal.valueOf(value).stripTrailingZeros().toPlainString()).build();
    }

    static AttributeValue stringSetValue(Collection<String> value)
    {
        requireNonNull(value, "value is null");
        if (value.isEmpty()) {
            return NULL_VALUE;
        }
        return AttributeValue.builder().ss(value).build();
    }

    static AttributeValue listValue(List<ValueBuilder> value)
    {
        requireNonNull(value, "value is null");
        if (value.isEmpty()) {
            return NULL_VALUE;
        }
        List<AttributeValue> attributeList = new ArrayList<>(value.size());
        for (ValueBuilder element : value) {
            attributeList.add(element.getAttributeValue());
        }
        return AttributeValue.builder().l(attributeList).build();
    }

    static AttributeValue mapValue(Map<String, ValueBuilder> value)
    {
        requireNonNull(value, "value is null");
        if (value.isEmpty()) {
            return NULL_VALUE;
        }
        Map<String, AttributeValue> attributeMap = new LinkedHashMap<>();
        for (Map.Entry<String, ValueBuilder> entry : value.entrySet()) {
            attributeMap.put(entry.getKey(), entry.getValue().getAttributeValue());
        }
        return AttributeValue.builder().m(attributeMap).build();
    }

    /**
     * Converts a plain Java object to an {@link AttributeValue}.
     *
     * @param value the object to convert, may be null
     * @return the converted attribute value
     */
    static AttributeValue toAttributeValue(Object value)
    {
        if (value == null) {
            return NULL_VALUE;
        }
        else if (value instanceof AttributeValue) {
            return (AttributeValue) value;
        }
        else if (value instanceof ValueBuilder) {
            return ((ValueBuilder) value).getAttributeValue();
        }
        else if (value instanceof String) {
            return AttributeValue.builder().s((String) value).build();
        }
        else if (value instanceof Boolean) {
            return AttributeValue.builder().bool((Boolean) value).build();
        }
        else if (value instanceof Number) {
            return AttributeValue.builder().n(toNumberString((Number) value)).build();
        }
        else if (value instanceof byte[]) {
            return AttributeValue.builder().b(SdkBytes.fromByteArray((byte[]) value)).build();
        }
        else if (value instanceof ByteBuffer) {
            return AttributeValue.builder().b(SdkBytes.fromByteBuffer((ByteBuffer) value)).build();
        }
        else if (value instanceof SdkBytes) {
            return AttributeValue.builder().b((SdkBytes) value).build();
        }
        else if (value instanceof Set<?>) {
            return handleSetType((Set<?>) value);
        }
        else if (value instanceof List<?>) {
            return handleListType((List<?>) value);
        }
        else if (value instanceof Map<?, ?>) {
            return handleMapType((Map<?, ?>) value);
        }
        throw new InvalidParameterException("valueOf", "ValueBuilder", "unsupported value type: " + value.getClass().getName());
    }

    private static String toNumberString(Number value)
    {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        else if (value instanceof BigInteger || value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        else if (value instanceof Float) {
            float floatValue = value.floatValue();
            checkArgument(Float.isFinite(floatValue), "DynamoDB numbers must be finite but was %s", floatValue);
            // through Float.toString so 1.1f renders as 1.1
            return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
        }
        return numberValue(value.doubleValue()).n();
    }

    private static AttributeValue handleSetType(Set<?> value)
    {
        if (value.isEmpty()) {
            return NULL_VALUE;
        }

        // The first element picks the set type, every element must then match it
        Object firstElement = value.iterator().next();
        if (firstElement instanceof String) {
            List<String> stringSet = new ArrayList<>(value.size());
            for (Object element : value) {
                if (!(element instanceof String)) {
                    throw unsupportedSetElement(element);
                }
                stringSet.add((String) element);
            }
            return AttributeValue.builder().ss(stringSet).build();
        }
        else if (firstElement instanceof Number) {
            List<String> numberSet = new ArrayList<>(value.size());
            for (Object element : value) {
                if (!(element instanceof Number)) {
                    throw unsupportedSetElement(element);
                }
                numberSet.add(toNumberString((Number) element));
            }
            return AttributeValue.builder().ns(numberSet).build();
        }
        else if (firstElement instanceof byte[] || firstElement instanceof SdkBytes) {
            List<SdkBytes> binarySet = new ArrayList<>(value.size());
            for (Object element : value) {
                if (element instanceof SdkBytes) {
                    binarySet.add((SdkBytes) element);
                }
                else if (element instanceof byte[]) {
                    binarySet.add(SdkBytes.fromByteArray((byte[]) element));
                }
                else {
                    throw unsupportedSetElement(element);
                }
            }
            return AttributeValue.builder().bs(binarySet).build();
        }

        throw unsupportedSetElement(firstElement);
    }

    private static InvalidParameterException unsupportedSetElement(Object element)
    {
        String elementType = element == null ? "null" : element.getClass().getName();
        return new InvalidParameterException("valueOf", "ValueBuilder", "unsupported set element type: " + elementType);
    }

    private static AttributeValue handleListType(List<?> value)
    {
        if (value.isEmpty()) {
            return NULL_VALUE;
        }
        List<AttributeValue> attributeList = new ArrayList<>(value.size());
        for (Object element : value) {
            attributeList.add(toAttributeValue(element));
        }
        return AttributeValue.builder().l(attributeList).build();
    }

    private static AttributeValue handleMapType(Map<?, ?> value)
    {
        if (value.isEmpty()) {
            return NULL_VALUE;
        }
        Map<String, AttributeValue> attributeMap = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : value.entrySet()) {
            attributeMap.put(String.valueOf(entry.getKey()), toAttributeValue(entry.getValue()));
        }
        return AttributeValue.builder().m(attributeMap).build();
    }
}
