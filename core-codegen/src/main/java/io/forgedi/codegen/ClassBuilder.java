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

import io.forgedi.common.Initializable;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.commons.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.forgedi.common.Preconditions.checkArgument;
import static io.forgedi.common.Preconditions.checkNotNull;
import static java.util.Collections.emptyList;
import static org.objectweb.asm.Opcodes.*;
import static org.objectweb.asm.Type.VOID_TYPE;
import static org.objectweb.asm.Type.getType;

/**
 * Intends for dynamic description of the behaviour of the object in runtime
 *
 * @param <T> type of item
 */
@SuppressWarnings("unchecked")
public final class ClassBuilder<T> implements Initializable<ClassBuilder<T>> {
	private static final Logger logger = LoggerFactory.getLogger(ClassBuilder.class);

	private final DefiningClassLoader classLoader;
	private final Class<? super T> superclass;

	private String className;
	private List<Class<?>> constructorParameters = emptyList();
	private final Map<Method, Expression> methods = new LinkedHashMap<>();

	// region builders
	private ClassBuilder(DefiningClassLoader classLoader, Class<? super T> superclass) {
		this.classLoader = classLoader;
		this.superclass = superclass;
	}

	public static <T> ClassBuilder<T> create(DefiningClassLoader classLoader, Class<? super T> superclass) {
		checkArgument(!superclass.isInterface() && !Modifier.isFinal(superclass.getModifiers()),
				"Cannot extend %s", superclass.getName());
		return new ClassBuilder<>(classLoader, superclass);
	}

	public ClassBuilder<T> withClassName(String name) {
		this.className = name;
		return this;
	}

	/**
	 * Declares the only constructor of the class, which passes its arguments to the
	 * superclass constructor with the same parameter types
	 */
	public ClassBuilder<T> withConstructor(List<Class<?>> parameterTypes) {
		this.constructorParameters = new ArrayList<>(parameterTypes);
		return this;
	}

	/**
	 * Creates a new public method for a dynamic class
	 *
	 * @param methodName    name of method
	 * @param returnType    type which returns this method
	 * @param argumentTypes list of types of arguments
	 * @param expression    function which will be processed
	 * @return changed ClassBuilder
	 */
	public ClassBuilder<T> withMethod(String methodName, Class<?> returnType, List<? extends Class<?>> argumentTypes, Expression expression) {
		methods.put(new Method(methodName, getType(returnType), argumentTypes.stream().map(Type::getType).toArray(Type[]::new)), expression);
		return this;
	}
	// endregion

	public String getClassName() {
		return checkNotNull(className, "Class name is not set");
	}

	public byte[] toBytecode() {
		String actualClassName = getClassName();
		ClassWriter cw = new DefiningClassWriter(classLoader);

		Type classType = getType('L' + actualClassName.replace('.', '/') + ';');
		Type superType = getType(superclass);

		cw.visit(V1_8, ACC_PUBLIC + ACC_FINAL + ACC_SUPER,
				classType.getInternalName(),
				null,
				superType.getInternalName(),
				null);

		{
			Type[] argumentTypes = constructorParameters.stream().map(Type::getType).toArray(Type[]::new);
			Method m = new Method("<init>", VOID_TYPE, argumentTypes);
			GeneratorAdapter g = new GeneratorAdapter(ACC_PUBLIC, m, null, null, cw);
			g.loadThis();
			g.loadArgs();
			g.invokeConstructor(superType, m);
			g.returnValue();
			g.endMethod();
		}

		for (Map.Entry<Method, Expression> entry : methods.entrySet()) {
			Method m = entry.getKey();
			GeneratorAdapter g = new GeneratorAdapter(ACC_PUBLIC, m, null, null, cw);
			Context ctx = new Context(classLoader, g, classType, superclass, m);
			ctx.cast(entry.getValue().load(ctx), m.getReturnType());
			g.returnValue();
			g.endMethod();
		}

		cw.visitEnd();
		byte[] bytecode = cw.toByteArray();
		logger.trace("Generated {} bytes for class {} extending {}", bytecode.length, actualClassName, superclass.getName());
		return bytecode;
	}

	public Class<T> build() {
		Class<?> definedClass = classLoader.defineClass(getClassName(), toBytecode());
		logger.trace("Defined new {}", definedClass);
		return (Class<T>) definedClass;
	}

	private static final class DefiningClassWriter extends ClassWriter {
		private final ClassLoader classLoader;

		DefiningClassWriter(ClassLoader classLoader) {
			super(COMPUTE_FRAMES | COMPUTE_MAXS);
			this.classLoader = classLoader;
		}

		@Override
		protected ClassLoader getClassLoader() {
			return classLoader;
		}
	}
}
