package sfuzz.model.type;

import sfuzz.model.wgsl.WgslExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Operations over the partial order between abstract types and their concretizations.
 */
public final class TypeLattice {
	private TypeLattice() {}

	/**
	 * Decides whether general is an abstraction of specific: the two are equal, general is a reference whose store type
	 * is an abstraction of specific, or general is (or has elements that are) an abstract numeric type that may
	 * concretize to the corresponding part of specific.
	 *
	 * The relation is not symmetric.
	 */
	public static boolean isAbstractionOf(Type general, Type specific) {
		if (general.equals(specific)) {
			return true;
		}
		return general.accept(new AbstractionVisitor(specific));
	}

	/**
	 * Folds the types left to right, moving to a more concrete type whenever the running result is an abstraction of
	 * the next type. If all the types are the same abstract type, that type is returned.
	 *
	 * @param types a non-empty list of types
	 * @return the common concretization of the types
	 * @throws NoCommonTypeException if the list is empty, or two of its types do not abstract one another
	 */
	public static Type findCommonType(List<Type> types) throws NoCommonTypeException {
		if (types.isEmpty()) {
			throw new NoCommonTypeException(new NoCommonTypeIssue(Collections.emptyList()));
		}
		Type result = types.get(0);
		for (Type type : types.subList(1, types.size())) {
			if (result.equals(type)) {
				continue;
			}
			if (isAbstractionOf(result, type)) {
				result = type;
			} else if (!isAbstractionOf(type, result)) {
				throw new NoCommonTypeException(new NoCommonTypeIssue(new ArrayList<>(types)));
			}
		}
		return result;
	}

	public static Type findCommonType(List<WgslExpression> expressions, TypeOracle oracle)
			throws NoCommonTypeException {
		List<Type> types = new ArrayList<>(expressions.size());
		for (WgslExpression expression : expressions) {
			types.add(oracle.typeOf(expression));
		}
		return findCommonType(types);
	}

	/**
	 * Resolves abstract integers to i32 and abstract floats to f32, including inside vectors, matrices and arrays. Any
	 * other type is returned unchanged.
	 */
	public static Type defaultConcretizationOf(Type type) {
		return type.accept(new DefaultConcretizationVisitor());
	}
}
