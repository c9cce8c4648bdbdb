package sfuzz.model.type;

import java.util.Objects;

/**
 * The type of an addressable location holding a value of the store type.
 */
public class ReferenceType extends Type {
	private final Type storeType;
	private final AddressSpace addressSpace;
	private final AccessMode accessMode;

	public ReferenceType(Type storeType, AddressSpace addressSpace, AccessMode accessMode) {
		this.storeType = storeType;
		this.addressSpace = addressSpace;
		this.accessMode = accessMode;
	}

	public Type getStoreType() {
		return storeType;
	}

	public AddressSpace getAddressSpace() {
		return addressSpace;
	}

	public AccessMode getAccessMode() {
		return accessMode;
	}

	@Override
	public int hashCode() {
		return Objects.hash(storeType, addressSpace, accessMode) * 31 + 4;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof ReferenceType)) return false;
		ReferenceType other = (ReferenceType) obj;
		return storeType.equals(other.storeType) &&
				addressSpace == other.addressSpace &&
				accessMode == other.accessMode;
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
