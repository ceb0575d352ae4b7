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

import java.lang.reflect.Array;
import java.util.List;

import static org.objectweb.asm.Type.getType;

/**
 * Creates a one-dimensional array filled with the values of the given expressions
 */
final class ExpressionArrayOf implements Expression {
	private final Class<?> componentType;
	private final List<Expression> elements;

	ExpressionArrayOf(Class<?> componentType, List<Expression> elements) {
		this.componentType = componentType;
		this.elements = elements;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Type elementType = getType(componentType);
		g.push(elements.size());
		g.newArray(elementType);
		for (int i = 0; i < elements.size(); i++) {
			g.dup();
			g.push(i);
			ctx.cast(elements.get(i).load(ctx), elementType);
			g.arrayStore(elementType);
		}
		return getType(Array.newInstance(componentType, 0).getClass());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ExpressionArrayOf that = (ExpressionArrayOf) o;

		return componentType.equals(that.componentType) && elements.equals(that.elements);
	}

	@Override
	public int hashCode() {
		return 31 * componentType.hashCode() + elements.hashCode();
	}
}
