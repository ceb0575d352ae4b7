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

import java.lang.reflect.Constructor;
import java.util.List;

import static io.forgedi.common.Preconditions.checkArgument;
import static org.objectweb.asm.Type.getType;
import static org.objectweb.asm.commons.Method.getMethod;

/**
 * Invokes a given constructor, converting each argument to the declared parameter type
 */
final class ExpressionConstructor implements Expression {
	private final Constructor<?> constructor;
	private final List<Expression> arguments;

	ExpressionConstructor(Constructor<?> constructor, List<Expression> arguments) {
		checkArgument(constructor.getParameterCount() == arguments.size(),
				"Constructor %s expects %s arguments, got %s", constructor, constructor.getParameterCount(), arguments.size());
		this.constructor = constructor;
		this.arguments = arguments;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Type ownerType = getType(constructor.getDeclaringClass());
		g.newInstance(ownerType);
		g.dup();
		Class<?>[] parameterTypes = constructor.getParameterTypes();
		for (int i = 0; i < arguments.size(); i++) {
			ctx.cast(arguments.get(i).load(ctx), parameterTypes[i]);
		}
		g.invokeConstructor(ownerType, getMethod(constructor));
		return ownerType;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ExpressionConstructor that = (ExpressionConstructor) o;

		return constructor.equals(that.constructor) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode() {
		return 31 * constructor.hashCode() + arguments.hashCode();
	}
}
