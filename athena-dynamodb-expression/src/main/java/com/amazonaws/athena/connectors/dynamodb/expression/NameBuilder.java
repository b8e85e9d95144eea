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
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.BUILD_OPERAND;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.NAME_PLACEHOLDER;

/**
 * An attribute path such as "foo.bar[0].baz". Each dot separated segment is aliased on its own while list
 * indexes are kept verbatim, so "foo.bar[0].baz" renders as "#0.#1[0].#2".
 */
public final class NameBuilder
        extends AbstractArithmeticOperandBuilder
{
    private static final String SUBJECT = "NameBuilder";
    private static final Splitter DOT_SPLITTER = Splitter.on('.');
    private static final Joiner DOT_JOINER = Joiner.on('.');

    private final String name;
    private final boolean splitPath;

    NameBuilder(String name, boolean splitPath)
    {
        this.name = name;
        this.splitPath = splitPath;
    }

    public String getName()
    {
        return name;
    }

    @Override
    public Operand buildOperand()
    {
        if (StringUtils.isEmpty(name)) {
            throw new UnsetParameterException(BUILD_OPERAND, SUBJECT);
        }

        if (!splitPath) {
            return new Operand(ExpressionNode.fromNames(ImmutableList.of(name), NAME_PLACEHOLDER));
        }

        List<String> names = new ArrayList<>();
        List<String> fmtNames = new ArrayList<>();
        for (String word : DOT_SPLITTER.split(name)) {
            if (word.isEmpty()) {
                throw new UnsetParameterException(BUILD_OPERAND, SUBJECT);
            }

            String index = "";
            if (word.endsWith("]")) {
                int open = word.indexOf('[');
                if (open >= 0) {
                    index = word.substring(open);
                    word = word.substring(0, open);
                }
            }

            // "[0]" on its own has no attribute to index into
            if (word.isEmpty()) {
                throw new UnsetParameterException(BUILD_OPERAND, SUBJECT);
            }

            names.add(word);
            fmtNames.add(NAME_PLACEHOLDER + index);
        }

        return new Operand(ExpressionNode.fromNames(names, DOT_JOINER.join(fmtNames)));
    }

    public SizeBuilder size()
    {
        return DDBExpressions.size(this);
    }

    public SetValueBuilder ifNotExists(OperandBuilder right)
    {
        return DDBExpressions.ifNotExists(this, right);
    }

    public ConditionBuilder attributeExists()
    {
        return DDBExpressions.attributeExists(this);
    }

    public ConditionBuilder attributeNotExists()
    {
        return DDBExpressions.attributeNotExists(this);
    }

    public ConditionBuilder attributeType(DynamoDBAttributeType attributeType)
    {
        return DDBExpressions.attributeType(this, attributeType);
    }

    public ConditionBuilder beginsWith(String prefix)
    {
        return DDBExpressions.beginsWith(this, prefix);
    }

    public ConditionBuilder contains(String substring)
    {
        return DDBExpressions.contains(this, substring);
    }

    public ProjectionBuilder namesList(NameBuilder... names)
    {
        return DDBExpressions.namesList(this, names);
    }
}
