package sfuzz.model.type;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

@RunWith(Parameterized.class)
public class TypeLatticeAbstractionTest {

	private static ReferenceType ref(Type store) {
		return new ReferenceType(store, AddressSpace.FUNCTION, AccessMode.READ_WRITE);
	}

	@Parameters(name = "{0} abstracts {1}: {2}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// scalars
				{ new AbstractIntType(), new I32Type(), true },
				{ new AbstractIntType(), new U32Type(), true },
				{ new AbstractIntType(), new AbstractFloatType(), true },
				{ new AbstractIntType(), new F32Type(), true },
				{ new AbstractIntType(), new F16Type(), true },
				{ new AbstractIntType(), new BoolType(), false },
				{ new AbstractFloatType(), new F32Type(), true },
				{ new AbstractFloatType(), new F16Type(), true },
				{ new AbstractFloatType(), new I32Type(), false },
				{ new AbstractFloatType(), new AbstractIntType(), false },
				{ new I32Type(), new AbstractIntType(), false },
				{ new F32Type(), new F16Type(), false },
				{ new U32Type(), new U32Type(), true },
				// composites
				{ new VectorType(2, new AbstractIntType()), new VectorType(2, new F32Type()), true },
				{ new VectorType(2, new AbstractIntType()), new VectorType(3, new F32Type()), false },
				{ new VectorType(4, new I32Type()), new VectorType(4, new AbstractIntType()), false },
				{ new MatrixType(3, 2, new AbstractFloatType()), new MatrixType(3, 2, new F16Type()), true },
				{ new MatrixType(3, 2, new AbstractFloatType()), new MatrixType(2, 3, new F16Type()), false },
				{ new ArrayType(new AbstractIntType(), 4), new ArrayType(new U32Type(), 4), true },
				{ new ArrayType(new AbstractIntType(), 4), new ArrayType(new U32Type(), 5), false },
				{ new ArrayType(new AbstractIntType(), null), new ArrayType(new I32Type(), null), true },
				{ new ArrayType(new AbstractIntType(), null), new ArrayType(new I32Type(), 2), false },
				// references abstract whatever their store type abstracts
				{ ref(new AbstractIntType()), new I32Type(), true },
				{ ref(new I32Type()), new I32Type(), true },
				{ ref(new I32Type()), new U32Type(), false },
				{ new I32Type(), ref(new I32Type()), false },
				{ ref(new F32Type()), ref(new F32Type()), true },
		});
	}

	private final Type general;
	private final Type specific;
	private final boolean expected;

	public TypeLatticeAbstractionTest(Type general, Type specific, boolean expected) {
		this.general = general;
		this.specific = specific;
		this.expected = expected;
	}

	@Test
	public void isAbstractionOf() {
		assertEquals(expected, TypeLattice.isAbstractionOf(general, specific));
	}

	@Test
	public void reflexive() {
		assertTrue(TypeLattice.isAbstractionOf(general, general));
		assertTrue(TypeLattice.isAbstractionOf(specific, specific));
	}

	@Test
	public void antisymmetricForDistinctTypes() {
		if (!general.equals(specific) && TypeLattice.isAbstractionOf(general, specific)) {
			assertFalse(TypeLattice.isAbstractionOf(specific, general));
		}
	}
}
