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

import java.lang.reflect.Field;

import static io.forgedi.common.Preconditions.checkArgument;
import static java.lang.reflect.Modifier.isStatic;
import static org.objectweb.asm.Type.VOID_TYPE;
import static org.objectweb.asm.Type.getType;

/**
 * Assigns a value to an instance field of {@code owner}
 */
final class ExpressionSetField implements Expression {
	private final Expression owner;
	private final Field field;
	private final Expression value;

	ExpressionSetField(Expression owner, Field field, Expression value) {
		checkArgument(!isStatic(field.getModifiers()), "Field %s is static", field);
		this.owner = owner;
		this.field = field;
		this.value = value;
	}

	@Override
	public Type load(Context ctx) {
		Type ownerType = getType(field.getDeclaringClass());
		Type fieldType = getType(field.getType());
		ctx.cast(owner.load(ctx), ownerType);
		ctx.cast(value.load(ctx), fieldType);
		ctx.getGeneratorAdapter().putField(ownerType, field.getName(), fieldType);
		return VOID_TYPE;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ExpressionSetField that = (ExpressionSetField) o;

		return owner.equals(that.owner) && field.equals(that.field) && value.equals(that.value);
	}

	@Override
	public int hashCode() {
		int result = owner.hashCode();
		result = 31 * result + field.hashCode();
		result = 31 * result + value.hashCode();
		return result;
	}
}
