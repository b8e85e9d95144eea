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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.NAME_ALIAS_PREFIX;
import static com.amazonaws.athena.connectors.dynamodb.expression.ExpressionConstants.VALUE_ALIAS_PREFIX;
import static java.util.Objects.requireNonNull;

/**
 * The rendered expressions of one build together with the ExpressionAttributeNames and
 * ExpressionAttributeValues maps they reference. Instances are immutable.
 *
 * <pre>
 * Expression expression = Expression.builder()
 *         .withKeyCondition(key("Artist").equal(value("No One You Know")))
 *         .withProjection(name("SongTitle").namesList(name("AlbumTitle")))
 *         .build();
 *
 * QueryRequest request = QueryRequest.builder()
 *         .tableName("Music")
 *         .keyConditionExpression(expression.getKeyCondition().orElse(null))
 *         .projectionExpression(expression.getProjection().orElse(null))
 *         .expressionAttributeNames(expression.getNames().orElse(null))
 *         .expressionAttributeValues(expression.getValues().orElse(null))
 *         .build();
 * </pre>
 */
public final class Expression
{
    private final Map<ExpressionType, String> expressions;
    private final Optional<Map<String, String>> names;
    private final Optional<Map<String, AttributeValue>> values;

    Expression(Map<ExpressionType, String> expressions,
               Optional<Map<String, String>> names,
               Optional<Map<String, AttributeValue>> values)
    {
        this.expressions = ImmutableMap.copyOf(requireNonNull(expressions, "expressions is null"));
        this.names = requireNonNull(names, "names is null");
        this.values = requireNonNull(values, "values is null");
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Optional<String> getCondition()
    {
        return getExpression(ExpressionType.CONDITION);
    }

    public Optional<String> getFilter()
    {
        return getExpression(ExpressionType.FILTER);
    }

    public Optional<String> getProjection()
    {
        return getExpression(ExpressionType.PROJECTION);
    }

    public Optional<String> getKeyCondition()
    {
        return getExpression(ExpressionType.KEY_CONDITION);
    }

    public Optional<String> getUpdate()
    {
        return getExpression(ExpressionType.UPDATE);
    }

    public Optional<String> getExpression(ExpressionType expressionType)
    {
        return Optional.ofNullable(expressions.get(expressionType));
    }

    /**
     * @return the #index to attribute name map, or empty if no expression referenced an attribute name
     */
    public Optional<Map<String, String>> getNames()
    {
        return names;
    }

    /**
     * @return the :index to value map, or empty if no expression referenced a value
     */
    public Optional<Map<String, AttributeValue>> getValues()
    {
        return values;
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

        Expression other = (Expression) obj;
        return Objects.equals(this.expressions, other.expressions) &&
                Objects.equals(this.names, other.names) &&
                Objects.equals(this.values, other.values);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(expressions, names, values);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                .add("expressions", expressions)
                .add("names", names)
                .add("values", values)
                .toString();
    }

    /**
     * Collects at most one builder per {@link ExpressionType}; setting a kind twice keeps the last builder.
     */
    public static final class Builder
    {
        private static final Logger logger = LoggerFactory.getLogger(Builder.class);

        private final Map<ExpressionType, TreeBuilder> treeBuilders = new EnumMap<>(ExpressionType.class);

        private Builder() {}

        public Builder withCondition(ConditionBuilder conditionBuilder)
        {
            return with(ExpressionType.CONDITION, conditionBuilder);
        }

        public Builder withFilter(ConditionBuilder filterBuilder)
        {
            return with(ExpressionType.FILTER, filterBuilder);
        }

        public Builder withProjection(ProjectionBuilder projectionBuilder)
        {
            return with(ExpressionType.PROJECTION, projectionBuilder);
        }

        public Builder withKeyCondition(KeyConditionBuilder keyConditionBuilder)
        {
            return with(ExpressionType.KEY_CONDITION, keyConditionBuilder);
        }

        public Builder withUpdate(UpdateBuilder updateBuilder)
        {
            return with(ExpressionType.UPDATE, updateBuilder);
        }

        private Builder with(ExpressionType expressionType, TreeBuilder treeBuilder)
        {
            treeBuilders.put(expressionType, requireNonNull(treeBuilder, "treeBuilder is null"));
            return this;
        }

        /**
         * Builds and renders every expression that was set, in {@link ExpressionType} order, against one shared
         * alias list. The first failure aborts the build.
         *
         * @return the rendered expressions and their alias maps
         */
        public Expression build()
        {
            AliasList aliasList = new AliasList();
            Map<ExpressionType, String> formattedExpressions = new EnumMap<>(ExpressionType.class);

            // EnumMap iterates in ordinal order
            for (Map.Entry<ExpressionType, TreeBuilder> entry : treeBuilders.entrySet()) {
                ExpressionNode node = entry.getValue().buildTree();
                formattedExpressions.put(entry.getKey(), node.buildExpressionString(aliasList));
            }

            logger.debug("build: rendered {} with {} name aliases and {} value aliases",
                    formattedExpressions.keySet(), aliasList.getNames().size(), aliasList.getValues().size());

            return new Expression(formattedExpressions, toNameMap(aliasList.getNames()), toValueMap(aliasList.getValues()));
        }

        private static Optional<Map<String, String>> toNameMap(List<String> names)
        {
            if (names.isEmpty()) {
                return Optional.empty();
            }
            ImmutableMap.Builder<String, String> nameMap = ImmutableMap.builder();
            for (int i = 0; i < names.size(); i++) {
                nameMap.put(NAME_ALIAS_PREFIX + i, names.get(i));
            }
            return Optional.of(nameMap.build());
        }

        private static Optional<Map<String, AttributeValue>> toValueMap(List<AttributeValue> values)
        {
            if (values.isEmpty()) {
                return Optional.empty();
            }
            ImmutableMap.Builder<String, AttributeValue> valueMap = ImmutableMap.builder();
            for (int i = 0; i < values.size(); i++) {
                valueMap.put(VALUE_ALIAS_PREFIX + i, values.get(i));
            }
            return Optional.of(valueMap.build());
        }
    }
}
