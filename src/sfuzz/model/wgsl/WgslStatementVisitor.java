package sfuzz.model.wgsl;

public abstract class WgslStatementVisitor<T, E extends Throwable>{

	public abstract T visit(WgslCompound compound) throws E;
	public abstract T visit(WgslIf wgslIf) throws E;
	public abstract T visit(WgslWhile wgslWhile) throws E;
	public abstract T visit(WgslAssignment assignment) throws E;
	public abstract T visit(WgslReturn wgslReturn) throws E;
	public abstract T visit(WgslBreak break1) throws E;
	public abstract T visit(WgslContinue continue1) throws E;
	public abstract T visit(WgslDiscard discard) throws E;

	// augmented statements
	public abstract T visit(DeletableStatement deletableStatement) throws E;
	public abstract T visit(EmptiableCompound emptiableCompound) throws E;
	public abstract T visit(DeadCodeFragment deadCodeFragment) throws E;
	public abstract T visit(ControlFlowWrapper controlFlowWrapper) throws E;
	public abstract T visit(WrappedOriginalStatements wrappedOriginalStatements) throws E;

}
