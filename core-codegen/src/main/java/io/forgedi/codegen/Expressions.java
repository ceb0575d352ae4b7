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

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;
import java.util.function.Function;

import static java.util.Arrays.asList;
import static org.objectweb.asm.Type.getType;

/**
 * Defines list of possibilities for creating dynamic objects
 */
public final class Expressions {
	private Expressions() {
	}

	public static Expression sequence(List<Expression> parts) {
		return new ExpressionSequence(parts);
	}

	/**
	 * Returns sequence of operations which will be processed one after the other
	 *
	 * @param parts list of operations
	 * @return new instance of the ExpressionSequence
	 */
	public static Expression sequence(Expression... parts) {
		return new ExpressionSequence(asList(parts));
	}

	/**
	 * Returns a new variable which will process expression
	 *
	 * @param expression expression which will be processed when variable will be used
	 * @return new instance of the Expression
	 */
	public static Expression let(Expression expression) {
		return new ExpressionLet(expression);
	}

	public static Expression let(Expression expression, Function<Expression, Expression> fn) {
		ExpressionLet let = new ExpressionLet(expression);
		return sequence(let, fn.apply(let));
	}

	/**
	 * Casts expression to the type
	 *
	 * @param expression expressions which will be casted
	 * @param type       expression will be casted to the 'type'
	 * @return new instance of the Expression which is casted to the type
	 */
	public static Expression cast(Expression expression, Type type) {
		return new ExpressionCast(expression, type);
	}

	public static Expression cast(Expression expression, Class<?> type) {
		return cast(expression, getType(type));
	}

	/**
	 * Returns a constant: a string, a boxed primitive, an enum constant or a class literal
	 */
	public static Expression value(Object value) {
		return new ExpressionConstant(value);
	}

	public static Expression nullRef(Class<?> type) {
		return new ExpressionNull(getType(type));
	}

	/**
	 * Returns current instance
	 *
	 * @return current instance of the Expression
	 */
	public static Expression self() {
		return new VarThis();
	}

	public static Expression constructor(Constructor<?> constructor, List<Expression> arguments) {
		return new ExpressionConstructor(constructor, arguments);
	}

	public static Expression constructor(Constructor<?> constructor, Expression... arguments) {
		return constructor(constructor, asList(arguments));
	}

	public static Expression call(Expression owner, Method method, List<Expression> arguments) {
		return new ExpressionCall(owner, method, arguments);
	}

	public static Expression call(Expression owner, Method method, Expression... arguments) {
		return call(owner, method, asList(arguments));
	}

	public static Expression callStatic(Method method, List<Expression> arguments) {
		return new ExpressionCallStatic(method, arguments);
	}

	public static Expression callStatic(Method method, Expression... arguments) {
		return callStatic(method, asList(arguments));
	}

	/**
	 * Calls a no-arg method added to the generated class with {@link ClassBuilder#withMethod}
	 */
	public static Expression callSelf(String methodName, Class<?> returnType) {
		return new ExpressionCallSelf(methodName, returnType);
	}

	public static Expression setField(Expression owner, Field field, Expression value) {
		return new ExpressionSetField(owner, field, value);
	}

	public static Expression arrayOf(Class<?> componentType, List<Expression> elements) {
		return new ExpressionArrayOf(componentType, elements);
	}

	public static Expression ifNull(Expression expression, Expression otherwise) {
		return new ExpressionIfNull(expression, otherwise);
	}
}
