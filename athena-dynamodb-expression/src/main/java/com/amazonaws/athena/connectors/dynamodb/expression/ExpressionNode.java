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

import com.amazonaws.athena.connectors.dynamodb.expression.exceptions.ExpressionException;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.List;
import java.util.Objects;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.CHILD_ESCAPE;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.ESCAPE;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.NAME_ESCAPE;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.VALUE_ESCAPE;
import static java.util.Objects.requireNonNull;

/**
 * Intermediate representation shared by every builder. A node holds raw attribute path segments, raw literal
 * values and child nodes, plus a template in which $n, $v and $c mark where the next name alias, value alias
 * and rendered child go. Nodes are immutable and form a pure tree.
 */
public final class ExpressionNode
{
    private final List<String> names;
    private final List<AttributeValue> values;
    private final List<ExpressionNode> children;
    private final String fmtExpression;

    private ExpressionNode(List<String> names, List<AttributeValue> values, List<ExpressionNode> children, String fmtExpression)
    {
        this.names = ImmutableList.copyOf(requireNonNull(names, "names is null"));
        this.values = ImmutableList.copyOf(requireNonNull(values, "values is null"));
        this.children = ImmutableList.copyOf(requireNonNull(children, "children is null"));
        this.fmtExpression = requireNonNull(fmtExpression, "fmtExpression is null");
    }

    static ExpressionNode fromNames(List<String> names, String fmtExpression)
    {
        return new ExpressionNode(names, ImmutableList.of(), ImmutableList.of(), fmtExpression);
    }

    static ExpressionNode fromValues(List<AttributeValue> values, String fmtExpression)
    {
        return new ExpressionNode(ImmutableList.of(), values, ImmutableList.of(), fmtExpression);
    }

    static ExpressionNode fromChildren(List<ExpressionNode> children, String fmtExpression)
    {
        return new ExpressionNode(ImmutableList.of(), ImmutableList.of(), children, fmtExpression);
    }

    static ExpressionNode of(List<String> names, List<AttributeValue> values, List<ExpressionNode> children, String fmtExpression)
    {
        return new ExpressionNode(names, values, children, fmtExpression);
    }

    /**
     * @param fmtExpression the replacement template
     * @return a copy of this node with the same payload and the given template
     */
    ExpressionNode withFmtExpression(String fmtExpression)
    {
        return new ExpressionNode(names, values, children, fmtExpression);
    }

    public List<String> getNames()
    {
        return names;
    }

    public List<AttributeValue> getValues()
    {
        return values;
    }

    public List<ExpressionNode> getChildren()
    {
        return children;
    }

    public String getFmtExpression()
    {
        return fmtExpression;
    }

    /**
     * Renders this node by walking its template left to right. Each escape consumes the next unused entry of
     * the matching payload list; names and values are aliased through the given list and children are rendered
     * recursively against the same list.
     *
     * @param aliasList the alias tables shared by the whole build
     * @return the rendered expression
     */
    String buildExpressionString(AliasList aliasList)
    {
        int nameIndex = 0;
        int valueIndex = 0;
        int childIndex = 0;

        StringBuilder formatted = new StringBuilder(fmtExpression.length());
        int idx = 0;
        while (idx < fmtExpression.length()) {
            char current = fmtExpression.charAt(idx);
            if (current != ESCAPE) {
                formatted.append(current);
                idx++;
                continue;
            }

            if (idx == fmtExpression.length() - 1) {
                throw new ExpressionException("buildexprNode error: invalid escape character");
            }

            char escape = fmtExpression.charAt(idx + 1);
            switch (escape) {
                case NAME_ESCAPE:
                    formatted.append(substitutePath(nameIndex++, aliasList));
                    break;
                case VALUE_ESCAPE:
                    formatted.append(substituteValue(valueIndex++, aliasList));
                    break;
                case CHILD_ESCAPE:
                    formatted.append(substituteChild(childIndex++, aliasList));
                    break;
                default:
                    throw new ExpressionException("buildexprNode error: invalid escape rune " + escape);
            }
            idx += 2;
        }

        return formatted.toString();
    }

    private String substitutePath(int index, AliasList aliasList)
    {
        if (index >= names.size()) {
            throw new ExpressionException("substitutePath error: exprNode []names out of range");
        }
        return aliasList.aliasPath(names.get(index));
    }

    private String substituteValue(int index, AliasList aliasList)
    {
        if (index >= values.size()) {
            throw new ExpressionException("substituteValue error: exprNode []values out of range");
        }
        return aliasList.aliasValue(values.get(index));
    }

    private String substituteChild(int index, AliasList aliasList)
    {
        if (index >= children.size()) {
            throw new ExpressionException("substituteChild error: exprNode []children out of range");
        }
        return children.get(index).buildExpressionString(aliasList);
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if ((obj == null) || (getClass() != obj.getClass())) {
            return false;
        }

        ExpressionNode other = (ExpressionNode) obj;
        return Objects.equals(this.names, other.names) &&
                Objects.equals(this.values, other.values) &&
                Objects.equals(this.children, other.children) &&
                Objects.equals(this.fmtExpression, other.fmtExpression);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(names, values, children, fmtExpression);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                .add("names", names)
                .add("values", values)
                .add("children", children)
                .add("fmtExpression", fmtExpression)
                .toString();
    }
}
