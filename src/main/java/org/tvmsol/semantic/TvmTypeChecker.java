package org.tvmsol.semantic;

import org.tvmsol.ast.*;
import org.tvmsol.diagnostic.DiagnosticKind;
import org.tvmsol.diagnostic.DiagnosticSink;
import org.tvmsol.diagnostic.SecondaryLocation;
import org.tvmsol.semantic.type.ArrayType;
import org.tvmsol.semantic.type.FunctionType;
import org.tvmsol.semantic.type.StructType;
import org.tvmsol.semantic.type.Type;
import org.tvmsol.semantic.type.TypeCategory;
import org.tvmsol.util.Debug;
import org.tvmsol.util.TvmVersion;

/**
 * Enforces what the TVM code generator needs beyond ordinary type correctness.
 * Runs after type checking, never changes the tree and reports every violation it finds.
 */
public class TvmTypeChecker implements AstVisitor<CheckContext>
{
	/**
	 * Maximum number of data bits in one TVM cell.
	 */
	public static final int CELL_BIT_LENGTH = 1023;

	private final DiagnosticSink sink;
	private final TvmVersion tvmVersion;
	private final OverrideOverloadAnalyzer overrideOverloadAnalyzer;
	private final SpecialMethodChecker specialMethodChecker;

	public TvmTypeChecker(DiagnosticSink sink, TvmVersion tvmVersion)
	{
		this.sink = sink;
		this.tvmVersion = tvmVersion;
		this.overrideOverloadAnalyzer = new OverrideOverloadAnalyzer(sink);
		this.specialMethodChecker = new SpecialMethodChecker(sink);
	}

	public void check(SourceUnit sourceUnit)
	{
		sourceUnit.accept(this, CheckContext.OUTSIDE_CONTRACT);
	}

	public TvmVersion getTvmVersion()
	{
		return tvmVersion;
	}

	private void typeError(SourceLocation location, String message)
	{
		sink.report(DiagnosticKind.TYPE_ERROR, location, message);
	}

	private void requireSupported(VmFeature feature, String spelling, SourceLocation location)
	{
		if (!VmFeatureGate.isSupported(feature, tvmVersion))
		{
			typeError(location, VmFeatureGate.notSupportedMessage(spelling));
		}
	}

	private void requireSupported(VmFeature feature, SourceLocation location)
	{
		requireSupported(feature, feature.getSpelling(), location);
	}

	// --- Declarations ---

	@Override
	public CheckContext visit(SourceUnit node, CheckContext context)
	{
		Debug.logDebug("TVM check of " + node.getPath() + " (tvm-version " + tvmVersion + ")");
		return context;
	}

	@Override
	public CheckContext visit(PragmaDirective node, CheckContext context)
	{
		if (!node.getLiterals().isEmpty() && node.getLiterals().get(0).equals("copyleft"))
		{
			requireSupported(VmFeature.COPYLEFT_PRAGMA, node.getLocation());
		}
		return context;
	}

	@Override
	public CheckContext visit(ContractDefinition node, CheckContext context)
	{
		Debug.logDebug("  -> Entering contract '" + node.getName() + "'");
		CheckContext inside = context.enterContract(node);
		overrideOverloadAnalyzer.analyze(node);
		return inside;
	}

	@Override
	public void endVisit(ContractDefinition node, CheckContext context)
	{
		Debug.logDebug("  -> Leaving contract '" + context.describe() + "'");
	}

	@Override
	public CheckContext visit(StructDefinition node, CheckContext context)
	{
		return context;
	}

	@Override
	public CheckContext visit(VariableDeclaration node, CheckContext context)
	{
		if (node.isStateVariable() && node.getType().getCategory() == TypeCategory.TVM_SLICE)
		{
			typeError(node.getLocation(), "This type can't be used for state variables.");
		}
		return context;
	}

	@Override
	public CheckContext visit(FunctionDefinition node, CheckContext context)
	{
		Debug.logDebug("  -> Checking " + node + " in " + context.describe());

		if (node.getFunctionId().isPresent())
		{
			if (node.getFunctionId().get() == 0)
			{
				typeError(node.getLocation(), "functionID can't be equal to zero because this value is reserved for receive function.");
			}
			if (!node.isPublic() && !node.getName().equals(SpecialMethodChecker.ON_CODE_UPGRADE))
			{
				typeError(node.getLocation(), "Only public/external functions and function `onCodeUpgrade` can have functionID.");
			}
			if (node.isReceive() || node.isFallback() || node.isOnTickTock() || node.isOnBounce())
			{
				typeError(node.getLocation(), "functionID isn't supported for receive, fallback, onBounce and onTickTock functions.");
			}
		}

		if (node.isInline() && node.isPublic())
		{
			typeError(node.getLocation(), "Inline function should have private or internal visibility");
		}

		if (node.getName().equals(SpecialMethodChecker.ON_CODE_UPGRADE))
		{
			specialMethodChecker.checkOnCodeUpgrade(node);
		}
		if (node.getName().equals(SpecialMethodChecker.AFTER_SIGNATURE_CHECK))
		{
			specialMethodChecker.checkAfterSignatureCheck(node);
		}
		return context;
	}

	// --- Type names ---

	@Override
	public CheckContext visit(ElementaryTypeName node, CheckContext context)
	{
		return context;
	}

	@Override
	public CheckContext visit(UserDefinedTypeName node, CheckContext context)
	{
		return context;
	}

	@Override
	public CheckContext visit(Mapping node, CheckContext context)
	{
		TypeName keyType = node.getKeyType();
		if (keyType instanceof UserDefinedTypeName && keyType.getType() instanceof StructType structType)
		{
			int bitLength = 0;
			for (VariableDeclaration member : structType.getStructDefinition().getMembers())
			{
				Type memberType = member.getType();
				if (!memberType.isNumeric())
				{
					sink.report(DiagnosticKind.TYPE_ERROR,
							keyType.getLocation(),
							new SecondaryLocation("Bad field: ", member.getLocation()),
							"If struct type is used as a key type for mapping, then "
									+ "fields of the struct must have integer, boolean, fixed bytes or enum type");
				}
				bitLength += memberType.getBitWidth();
			}
			if (bitLength > CELL_BIT_LENGTH)
			{
				typeError(keyType.getLocation(), "If struct type is used as a key type for mapping, then "
						+ "struct must fit in " + CELL_BIT_LENGTH + " bits");
			}
		}
		return context;
	}

	@Override
	public CheckContext visit(ArrayTypeName node, CheckContext context)
	{
		return context;
	}

	// --- Statements ---

	@Override
	public CheckContext visit(Block node, CheckContext context)
	{
		return context;
	}

	@Override
	public CheckContext visit(ExpressionStatement node, CheckContext context)
	{
		return context;
	}

	@Override
	public CheckContext visit(VariableDeclarationStatement node, CheckContext context)
	{
		return context;
	}

	@Override
	public CheckContext visit(Return node, CheckContext context)
	{
		return context;
	}

	// --- Expressions ---

	@Override
	public CheckContext visit(Identifier node, CheckContext context)
	{
		return context;
	}

	@Override
	public CheckContext visit(Literal node, CheckContext context)
	{
		return context;
	}

	@Override
	public CheckContext visit(MemberAccess node, CheckContext context)
	{
		Expression expression = node.getExpression();
		if (expression.getType().getCategory() == TypeCategory.MAGIC)
		{
			String member = node.getMemberName();
			if (member.equals("storageFee"))
			{
				requireSupported(VmFeature.TX_STORAGE_FEE, node.getLocation());
			}
			if (expression instanceof Identifier identifier && identifier.getName().equals("gosh"))
			{
				requireSupported(VmFeature.GOSH_NAMESPACE, "\"gosh." + member + "\"", node.getLocation());
			}
		}
		return context;
	}

	@Override
	public CheckContext visit(FunctionCall node, CheckContext context)
	{
		if (node.getExpression().getType() instanceof FunctionType functionType)
		{
			if (functionType.getKind() == FunctionType.FunctionKind.TVM_INIT_CODE_HASH)
			{
				requireSupported(VmFeature.TVM_INIT_CODE_HASH, node.getLocation());
			}
			else if (functionType.getKind() == FunctionType.FunctionKind.TVM_CODE)
			{
				requireSupported(VmFeature.TVM_CODE, node.getLocation());
			}
		}

		if (node.isAwait())
		{
			requireSupported(VmFeature.AWAIT, node.getLocation());
		}
		return context;
	}

	@Override
	public CheckContext visit(IndexAccess node, CheckContext context)
	{
		return context;
	}

	@Override
	public CheckContext visit(IndexRangeAccess node, CheckContext context)
	{
		Type baseType = node.getBaseExpression().getType();
		if (!(baseType instanceof ArrayType arrayType) || !arrayType.isByteArrayOrString())
		{
			typeError(node.getLocation(), "Index range access is available only for bytes.");
		}
		return context;
	}
}
