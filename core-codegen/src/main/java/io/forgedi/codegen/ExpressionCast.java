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

import org.objectweb.asm.Type;

final class ExpressionCast implements Expression {
	private final Expression expression;
	private final Type targetType;

	ExpressionCast(Expression expression, Type targetType) {
		this.expression = expression;
		this.targetType = targetType;
	}

	@Override
	public Type load(Context ctx) {
		Type type = expression.load(ctx);
		ctx.cast(type, targetType);
		return targetType;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ExpressionCast that = (ExpressionCast) o;

		return expression.equals(that.expression) && targetType.equals(that.targetType);
	}

	@Override
	public int hashCode() {
		return 31 * expression.hashCode() + targetType.hashCode();
	}
}
