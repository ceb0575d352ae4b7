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

import static org.objectweb.asm.Opcodes.ACONST_NULL;

final class ExpressionNull implements Expression {
	private final Type type;

	ExpressionNull(Type type) {
		this.type = type;
	}

	@Override
	public Type load(Context ctx) {
		ctx.getGeneratorAdapter().visitInsn(ACONST_NULL);
		return type;
	}
}
