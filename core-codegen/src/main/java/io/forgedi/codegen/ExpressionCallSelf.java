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
import org.objectweb.asm.commons.Method;

import static io.forgedi.common.Preconditions.checkNotNull;
import static org.objectweb.asm.Type.getType;

/**
 * Invokes a no-arg method declared by the class being generated
 */
final class ExpressionCallSelf implements Expression {
	private final String methodName;
	private final Class<?> returnType;

	ExpressionCallSelf(String methodName, Class<?> returnType) {
		this.methodName = checkNotNull(methodName);
		this.returnType = checkNotNull(returnType);
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Type type = getType(returnType);
		g.loadThis();
		g.invokeVirtual(ctx.getSelfType(), new Method(methodName, type, new Type[0]));
		return type;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ExpressionCallSelf that = (ExpressionCallSelf) o;

		return methodName.equals(that.methodName) && returnType.equals(that.returnType);
	}

	@Override
	public int hashCode() {
		return 31 * methodName.hashCode() + returnType.hashCode();
	}
}
