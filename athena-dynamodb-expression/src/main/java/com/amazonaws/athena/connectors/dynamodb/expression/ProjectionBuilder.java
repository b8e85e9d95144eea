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
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.BUILD_TREE;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.CHILD_PLACEHOLDER;
import static java.util.Objects.requireNonNull;

/**
 * A projection expression: the ordered list of attributes to retrieve. Duplicate names are allowed and end up
 * sharing one alias.
 */
public final class ProjectionBuilder
        implements TreeBuilder
{
    private static final Joiner COMMA_JOINER = Joiner.on(", ");

    private final List<NameBuilder> names;

    /**
     * Creates an empty projection. Building its tree fails until names are added.
     */
    public ProjectionBuilder()
    {
        this(ImmutableList.of());
    }

    ProjectionBuilder(List<NameBuilder> names)
    {
        this.names = ImmutableList.copyOf(requireNonNull(names, "names is null"));
    }

    List<NameBuilder> getNames()
    {
        return names;
    }

    /**
     * @param namesToAdd the names to append, in order
     * @return a new projection with the given names appended
     */
    public ProjectionBuilder addNames(NameBuilder... namesToAdd)
    {
        return new ProjectionBuilder(ImmutableList.<NameBuilder>builder()
                .addAll(names)
                .addAll(Arrays.asList(namesToAdd))
                .build());
    }

    @Override
    public ExpressionNode buildTree()
    {
        if (names.isEmpty()) {
            throw new UnsetParameterException(BUILD_TREE, "ProjectionBuilder");
        }

        List<ExpressionNode> childNodes = new ArrayList<>(names.size());
        for (NameBuilder name : names) {
            childNodes.add(name.buildOperand().getExpressionNode());
        }
        return ExpressionNode.fromChildren(childNodes, COMMA_JOINER.join(Collections.nCopies(names.size(), CHILD_PLACEHOLDER)));
    }
}
