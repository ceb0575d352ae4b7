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

import static io.forgedi.codegen.Utils.*;
import static java.lang.String.format;
import static org.objectweb.asm.Type.VOID_TYPE;
import static org.objectweb.asm.Type.getType;

/**
 * Contains information about the method of a dynamic class being generated
 */
public final class Context {
	private static final Type OBJECT_TYPE = getType(Object.class);

	private final ClassLoader classLoader;
	private final GeneratorAdapter g;
	private final Type selfType;
	private final Class<?> superclass;
	private final Method method;

	public Context(ClassLoader classLoader, GeneratorAdapter g, Type selfType, Class<?> superclass, Method method) {
		this.classLoader = classLoader;
		this.g = g;
		this.selfType = selfType;
		this.superclass = superclass;
		this.method = method;
	}

	public GeneratorAdapter getGeneratorAdapter() {
		return g;
	}

	public Type getSelfType() {
		return selfType;
	}

	public Class<?> getSuperclass() {
		return superclass;
	}

	public Method getMethod() {
		return method;
	}

	public Class<?> toJavaType(Type type) {
		if (type.equals(selfType))
			return superclass;
		switch (type.getSort()) {
			case Type.BOOLEAN:
				return boolean.class;
			case Type.CHAR:
				return char.class;
			case Type.BYTE:
				return byte.class;
			case Type.SHORT:
				return short.class;
			case Type.INT:
				return int.class;
			case Type.FLOAT:
				return float.class;
			case Type.LONG:
				return long.class;
			case Type.DOUBLE:
				return double.class;
			case Type.VOID:
				return void.class;
			case Type.OBJECT:
				try {
					return Class.forName(type.getClassName(), false, classLoader);
				} catch (ClassNotFoundException e) {
					throw new IllegalArgumentException(format("No class %s in class loader", type.getClassName()), e);
				}
			case Type.ARRAY:
				String className = type.getDescriptor().replace('/', '.');
				try {
					return Class.forName(className, false, classLoader);
				} catch (ClassNotFoundException e) {
					throw new IllegalArgumentException(format("No class %s in class loader", className), e);
				}
			default:
				throw new IllegalArgumentException(format("No Java type for %s", type.getClassName()));
		}
	}

	/**
	 * Converts the value on top of the stack from {@code type} to {@code targetType},
	 * boxing, unboxing or checking the cast as needed
	 */
	public void cast(Type type, Type targetType) {
		if (type.equals(targetType)) {
			return;
		}

		if (targetType == VOID_TYPE) {
			if (type.getSize() == 1)
				g.pop();
			if (type.getSize() == 2)
				g.pop2();
			return;
		}

		if (type == VOID_TYPE) {
			throw new IllegalArgumentException(format("Can't cast VOID_TYPE to %s. %s",
					targetType.getClassName(),
					exceptionInGeneratedClass(this)));
		}

		if (isPrimitiveType(type)) {
			if (isPrimitiveType(targetType)) {
				if (isValidCast(type, targetType)) {
					g.cast(type, targetType);
				}
				return;
			}
			g.valueOf(type);
			type = wrap(type);
			if (type.equals(targetType)) {
				return;
			}
		}

		if (isPrimitiveType(targetType)) {
			if (isWrapperType(type) && unwrap(type).equals(targetType)) {
				g.invokeVirtual(type, primitiveValueMethod(targetType));
			} else {
				g.unbox(targetType);
			}
			return;
		}

		if (targetType.equals(OBJECT_TYPE)) {
			return;
		}

		// self type is checked against its superclass, it is not loadable while being generated
		if ((type.getSort() == Type.OBJECT || type.getSort() == Type.ARRAY) &&
				toJavaType(targetType).isAssignableFrom(toJavaType(type))) {
			return;
		}

		g.checkCast(targetType);
	}

	public void cast(Type type, Class<?> targetType) {
		cast(type, getType(targetType));
	}
}
