package org.tvmsol.ast;

/**
 * One method per node kind and no default methods, so a new node kind does not compile until
 * every visitor handles it.
 *
 * <p>Each {@code visit} returns the context the node's children are visited with.</p>
 *
 * @param <C> traversal context threaded through the walk
 */
public interface AstVisitor<C>
{
	C visit(SourceUnit node, C context);

	C visit(PragmaDirective node, C context);

	C visit(ContractDefinition node, C context);

	void endVisit(ContractDefinition node, C context);

	C visit(StructDefinition node, C context);

	C visit(VariableDeclaration node, C context);

	C visit(FunctionDefinition node, C context);

	C visit(ElementaryTypeName node, C context);

	C visit(UserDefinedTypeName node, C context);

	C visit(Mapping node, C context);

	C visit(ArrayTypeName node, C context);

	C visit(Block node, C context);

	C visit(ExpressionStatement node, C context);

	C visit(VariableDeclarationStatement node, C context);

	C visit(Return node, C context);

	C visit(Identifier node, C context);

	C visit(Literal node, C context);

	C visit(MemberAccess node, C context);

	C visit(FunctionCall node, C context);

	C visit(IndexAccess node, C context);

	C visit(IndexRangeAccess node, C context);
}
