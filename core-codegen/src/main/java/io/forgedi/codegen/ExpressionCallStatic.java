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

import org.jetbrains.annotations.NotNull;
import org.objectweb.asm.Type;

import java.lang.reflect.Method;
import java.util.List;

import static io.forgedi.common.Preconditions.checkArgument;
import static java.lang.reflect.Modifier.isStatic;
import static org.objectweb.asm.Type.getType;

final class ExpressionCallStatic implements Expression {
	private final Method method;
	private final List<Expression> arguments;

	ExpressionCallStatic(@NotNull Method method, @NotNull List<Expression> arguments) {
		checkArgument(isStatic(method.getModifiers()), "Method %s is not static", method);
		checkArgument(method.getParameterCount() == arguments.size(),
				"Method %s expects %s arguments, got %s", method, method.getParameterCount(), arguments.size());
		this.method = method;
		this.arguments = arguments;
	}

	@Override
	public Type load(Context ctx) {
		Class<?>[] parameterTypes = method.getParameterTypes();
		for (int i = 0; i < arguments.size(); i++) {
			ctx.cast(arguments.get(i).load(ctx), parameterTypes[i]);
		}
		ctx.getGeneratorAdapter().invokeStatic(getType(method.getDeclaringClass()),
				org.objectweb.asm.commons.Method.getMethod(method));
		return getType(method.getReturnType());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ExpressionCallStatic that = (ExpressionCallStatic) o;

		return method.equals(that.method) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode() {
		return 31 * method.hashCode() + arguments.hashCode();
	}
}
