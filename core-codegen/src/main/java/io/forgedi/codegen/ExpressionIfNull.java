/*
 * Copyright (C) 2015-2019 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.forgedi.codegen;

import org.objectweb.asm.Label;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;

import static org.objectweb.asm.Type.getType;

/**
 * Yields the value of {@code expression} unless it is {@code null}, in which case
 * {@code otherwise} is evaluated instead. Both branches are widened to {@code Object}.
 */
final class ExpressionIfNull implements Expression {
	private static final Type OBJECT_TYPE = getType(Object.class);

	private final Expression expression;
	private final Expression otherwise;

	ExpressionIfNull(Expression expression, Expression otherwise) {
		this.expression = expression;
		this.otherwise = otherwise;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Label labelExit = new Label();

		ctx.cast(expression.load(ctx), OBJECT_TYPE);
		g.dup();
		g.ifNonNull(labelExit);
		g.pop();
		ctx.cast(otherwise.load(ctx), OBJECT_TYPE);

		g.mark(labelExit);
		return OBJECT_TYPE;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ExpressionIfNull that = (ExpressionIfNull) o;

		return expression.equals(that.expression) && otherwise.equals(that.otherwise);
	}

	@Override
	public int hashCode() {
		return 31 * expression.hashCode() + otherwise.hashCode();
	}
}
