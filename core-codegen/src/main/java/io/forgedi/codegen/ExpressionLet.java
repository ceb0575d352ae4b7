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

/**
 * Evaluates an expression once into a fresh local variable; every later load reads the variable
 */
final class ExpressionLet implements Expression {
	private final Expression expression;
	private VarLocal var;
	private Type type;

	ExpressionLet(Expression expression) {
		this.expression = expression;
	}

	@Override
	public Type load(Context ctx) {
		if (var == null) {
			type = expression.load(ctx);
			var = new VarLocal(ctx.getGeneratorAdapter().newLocal(type));
			var.store(ctx);
		}
		var.load(ctx);
		return type;
	}
}
