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
import org.objectweb.asm.commons.GeneratorAdapter;

import java.lang.reflect.Method;
import java.util.List;

import static io.forgedi.common.Preconditions.checkArgument;
import static java.lang.reflect.Modifier.isStatic;
import static org.objectweb.asm.Type.getType;

/**
 * Invokes an instance method on the value of {@code owner}
 */
final class ExpressionCall implements Expression {
	private final Expression owner;
	private final Method method;
	private final List<Expression> arguments;

	ExpressionCall(Expression owner, Method method, List<Expression> arguments) {
		checkArgument(!isStatic(method.getModifiers()), "Method %s is static", method);
		checkArgument(method.getParameterCount() == arguments.size(),
				"Method %s expects %s arguments, got %s", method, method.getParameterCount(), arguments.size());
		this.owner = owner;
		this.method = method;
		this.arguments = arguments;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Class<?> declaringClass = method.getDeclaringClass();
		ctx.cast(owner.load(ctx), declaringClass);

		Class<?>[] parameterTypes = method.getParameterTypes();
		for (int i = 0; i < arguments.size(); i++) {
			ctx.cast(arguments.get(i).load(ctx), parameterTypes[i]);
		}

		org.objectweb.asm.commons.Method asmMethod = org.objectweb.asm.commons.Method.getMethod(method);
		if (declaringClass.isInterface()) {
			g.invokeInterface(getType(declaringClass), asmMethod);
		} else {
			g.invokeVirtual(getType(declaringClass), asmMethod);
		}
		return getType(method.getReturnType());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ExpressionCall that = (ExpressionCall) o;

		return owner.equals(that.owner) && method.equals(that.method) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode() {
		int result = owner.hashCode();
		result = 31 * result + method.hashCode();
		result = 31 * result + arguments.hashCode();
		return result;
	}
}
