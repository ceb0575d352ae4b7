package io.forgedi.common;

@FunctionalInterface
public interface Initializer<T extends Initializable<T>> {
	void accept(T t);

	default Initializer<T> andThen(Initializer<T> next) {
		return t -> {
			this.accept(t);
			next.accept(t);
		};
	}
}
