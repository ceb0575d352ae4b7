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

import java.util.HashMap;
import java.util.Map;

import static io.forgedi.common.Preconditions.checkState;

/**
 * Represents a loader for defining dynamically generated classes.
 * Each class name can be defined only once per loader.
 */
public final class DefiningClassLoader extends ClassLoader {
	private final Map<String, Class<?>> definedClasses = new HashMap<>();

	// region builders
	private DefiningClassLoader() {
	}

	private DefiningClassLoader(ClassLoader parent) {
		super(parent);
	}

	public static DefiningClassLoader create() {return new DefiningClassLoader();}

	public static DefiningClassLoader create(ClassLoader parent) {return new DefiningClassLoader(parent);}
	// endregion

	public synchronized Class<?> defineClass(String className, byte[] bytecode) {
		checkState(!definedClasses.containsKey(className), "Class %s is already defined", className);
		Class<?> definedClass = defineClass(className, bytecode, 0, bytecode.length);
		definedClasses.put(className, definedClass);
		return definedClass;
	}

	public synchronized int getDefinedClassesCount() {
		return definedClasses.size();
	}

	@Override
	public String toString() {
		return "{classes=" + getDefinedClassesCount() + '}';
	}
}
