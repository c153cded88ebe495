package org.lokray.fbs.frontend;

import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.lokray.fbs.ast.Attribute;
import org.lokray.fbs.ast.Declaration;
import org.lokray.fbs.ast.Directive;
import org.lokray.fbs.ast.DocComment;
import org.lokray.fbs.ast.EnumDeclaration;
import org.lokray.fbs.ast.EnumValueNode;
import org.lokray.fbs.ast.FieldNode;
import org.lokray.fbs.ast.Literal;
import org.lokray.fbs.ast.Metadata;
import org.lokray.fbs.ast.NamedTypeNode;
import org.lokray.fbs.ast.RpcMethodNode;
import org.lokray.fbs.ast.RpcServiceDeclaration;
import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.ast.ScalarTypeNode;
import org.lokray.fbs.ast.Schema;
import org.lokray.fbs.ast.SchemaElement;
import org.lokray.fbs.ast.StringTypeNode;
import org.lokray.fbs.ast.StructDeclaration;
import org.lokray.fbs.ast.TableDeclaration;
import org.lokray.fbs.ast.TypeNode;
import org.lokray.fbs.ast.UnionDeclaration;
import org.lokray.fbs.ast.UnionVariantNode;
import org.lokray.fbs.ast.VectorTypeNode;
import org.lokray.fbs.diagnostic.SourcePosition;
import org.lokray.fbs.parser.FbsParser;
import org.lokray.fbs.parser.FbsParserBaseVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts an error-free parse tree into the immutable AST.
 * <p>
 * The namespace opened by the last {@code namespace} directive is threaded
 * through the declaration builders as a plain argument, so a builder instance
 * holds no parse state besides the token stream it reads doc comments from.
 */
public class AstBuilder extends FbsParserBaseVisitor<Object>
{
	private final String sourceName;
	private final BufferedTokenStream tokens;

	public AstBuilder(String sourceName, BufferedTokenStream tokens)
	{
		this.sourceName = sourceName;
		this.tokens = tokens;
	}

	public Schema build(FbsParser.SchemaContext ctx)
	{
		List<SchemaElement> elements = new ArrayList<>();
		for (FbsParser.IncludeDirectiveContext include : ctx.includeDirective())
		{
			elements.add(new Directive(Directive.Kind.INCLUDE, unquote(include.STRING_LITERAL()), "", position(include.start)));
		}

		String namespace = "";
		for (FbsParser.ElementContext element : ctx.element())
		{
			if (element.namespaceDeclaration() != null)
			{
				FbsParser.NamespaceDeclarationContext nsCtx = element.namespaceDeclaration();
				namespace = nsCtx.qualifiedName() != null ? nsCtx.qualifiedName().getText() : "";
				elements.add(new Directive(Directive.Kind.NAMESPACE, namespace, namespace, position(nsCtx.start)));
			}
			else
			{
				elements.add(buildElement(element, namespace));
			}
		}
		return new Schema(sourceName, elements);
	}

	private SchemaElement buildElement(FbsParser.ElementContext ctx, String namespace)
	{
		if (ctx.typeDeclaration() != null)
		{
			return buildTypeDeclaration(ctx.typeDeclaration(), namespace);
		}
		if (ctx.enumDeclaration() != null)
		{
			return buildEnum(ctx.enumDeclaration(), namespace);
		}
		if (ctx.unionDeclaration() != null)
		{
			return buildUnion(ctx.unionDeclaration(), namespace);
		}
		if (ctx.rpcServiceDeclaration() != null)
		{
			return buildRpcService(ctx.rpcServiceDeclaration(), namespace);
		}
		if (ctx.rootTypeDeclaration() != null)
		{
			FbsParser.RootTypeDeclarationContext root = ctx.rootTypeDeclaration();
			return new Directive(Directive.Kind.ROOT_TYPE, root.qualifiedName().getText(), namespace, position(root.start));
		}
		if (ctx.fileIdentifierDeclaration() != null)
		{
			FbsParser.FileIdentifierDeclarationContext id = ctx.fileIdentifierDeclaration();
			return new Directive(Directive.Kind.FILE_IDENTIFIER, unquote(id.STRING_LITERAL()), namespace, position(id.start));
		}
		if (ctx.fileExtensionDeclaration() != null)
		{
			FbsParser.FileExtensionDeclarationContext ext = ctx.fileExtensionDeclaration();
			return new Directive(Directive.Kind.FILE_EXTENSION, unquote(ext.STRING_LITERAL()), namespace, position(ext.start));
		}
		FbsParser.AttributeDeclarationContext attr = ctx.attributeDeclaration();
		String name = attr.ID() != null ? attr.ID().getText() : unquote(attr.STRING_LITERAL());
		return new Directive(Directive.Kind.ATTRIBUTE, name, namespace, position(attr.start));
	}

	// --- Declarations ---

	private Declaration buildTypeDeclaration(FbsParser.TypeDeclarationContext ctx, String namespace)
	{
		List<FieldNode> fields = new ArrayList<>();
		for (FbsParser.FieldDeclarationContext fieldCtx : ctx.fieldDeclaration())
		{
			fields.add(buildField(fieldCtx));
		}

		String name = ctx.ID().getText();
		Metadata metadata = metadataOf(ctx.metadata());
		DocComment doc = docCommentOf(ctx);
		SourcePosition position = position(ctx.ID().getSymbol());

		if (ctx.STRUCT_KW() != null)
		{
			return new StructDeclaration(name, namespace, fields, metadata, doc, position);
		}
		return new TableDeclaration(name, namespace, fields, metadata, doc, position);
	}

	private FieldNode buildField(FbsParser.FieldDeclarationContext ctx)
	{
		Literal defaultValue = null;
		if (ctx.defaultValue() != null)
		{
			FbsParser.DefaultValueContext value = ctx.defaultValue();
			defaultValue = value.ID() != null
					? Literal.identifier(value.ID().getText())
					: visitScalarLiteral(value.scalarLiteral());
		}
		return new FieldNode(
				ctx.ID().getText(),
				visitType(ctx.type()),
				defaultValue,
				metadataOf(ctx.metadata()),
				docCommentOf(ctx),
				position(ctx.ID().getSymbol()));
	}

	private EnumDeclaration buildEnum(FbsParser.EnumDeclarationContext ctx, String namespace)
	{
		List<EnumValueNode> values = new ArrayList<>();
		for (FbsParser.EnumValueDeclarationContext valueCtx : ctx.enumValueDeclaration())
		{
			Literal value = valueCtx.INTEGER_LITERAL() != null ? Literal.integer(valueCtx.INTEGER_LITERAL().getText()) : null;
			values.add(new EnumValueNode(
					valueCtx.ID().getText(),
					value,
					metadataOf(valueCtx.metadata()),
					docCommentOf(valueCtx),
					position(valueCtx.ID().getSymbol())));
		}
		return new EnumDeclaration(
				ctx.ID().getText(),
				namespace,
				visitType(ctx.type()),
				values,
				metadataOf(ctx.metadata()),
				docCommentOf(ctx),
				position(ctx.ID().getSymbol()));
	}

	private UnionDeclaration buildUnion(FbsParser.UnionDeclarationContext ctx, String namespace)
	{
		List<UnionVariantNode> variants = new ArrayList<>();
		for (FbsParser.UnionVariantDeclarationContext variantCtx : ctx.unionVariantDeclaration())
		{
			String alias = variantCtx.ID() != null ? variantCtx.ID().getText() : null;
			variants.add(new UnionVariantNode(
					alias,
					variantCtx.qualifiedName().getText(),
					metadataOf(variantCtx.metadata()),
					docCommentOf(variantCtx),
					position(variantCtx.start)));
		}
		return new UnionDeclaration(
				ctx.ID().getText(),
				namespace,
				variants,
				metadataOf(ctx.metadata()),
				docCommentOf(ctx),
				position(ctx.ID().getSymbol()));
	}

	private RpcServiceDeclaration buildRpcService(FbsParser.RpcServiceDeclarationContext ctx, String namespace)
	{
		List<RpcMethodNode> methods = new ArrayList<>();
		for (FbsParser.RpcMethodDeclarationContext methodCtx : ctx.rpcMethodDeclaration())
		{
			methods.add(new RpcMethodNode(
					methodCtx.ID().getText(),
					methodCtx.request.getText(),
					methodCtx.response.getText(),
					metadataOf(methodCtx.metadata()),
					docCommentOf(methodCtx),
					position(methodCtx.ID().getSymbol())));
		}
		return new RpcServiceDeclaration(
				ctx.ID().getText(),
				namespace,
				methods,
				metadataOf(ctx.metadata()),
				docCommentOf(ctx),
				position(ctx.ID().getSymbol()));
	}

	// --- Types, metadata and literals ---

	@Override
	public TypeNode visitType(FbsParser.TypeContext ctx)
	{
		if (ctx.L_BRACK_SYM() != null)
		{
			return new VectorTypeNode(visitType(ctx.type()));
		}

		String name = ctx.qualifiedName().getText();
		if (name.equals("string"))
		{
			return StringTypeNode.INSTANCE;
		}
		return ScalarKind.fromKeyword(name)
				.<TypeNode>map(kind -> new ScalarTypeNode(kind, name))
				.orElseGet(() -> new NamedTypeNode(name));
	}

	@Override
	public Metadata visitMetadata(FbsParser.MetadataContext ctx)
	{
		List<Attribute> attributes = new ArrayList<>();
		for (FbsParser.AttributeEntryContext entry : ctx.attributeEntry())
		{
			Literal value = null;
			if (entry.attributeValue() != null)
			{
				FbsParser.AttributeValueContext valueCtx = entry.attributeValue();
				value = valueCtx.STRING_LITERAL() != null
						? Literal.string(unquote(valueCtx.STRING_LITERAL()))
						: visitScalarLiteral(valueCtx.scalarLiteral());
			}
			attributes.add(new Attribute(entry.ID().getText(), value));
		}
		return attributes.isEmpty() ? Metadata.EMPTY : new Metadata(attributes);
	}

	@Override
	public Literal visitScalarLiteral(FbsParser.ScalarLiteralContext ctx)
	{
		if (ctx.INTEGER_LITERAL() != null)
		{
			return new Literal(Literal.Kind.INTEGER, ctx.INTEGER_LITERAL().getText());
		}
		if (ctx.FLOAT_LITERAL() != null)
		{
			return new Literal(Literal.Kind.FLOAT, ctx.FLOAT_LITERAL().getText());
		}
		return new Literal(Literal.Kind.BOOLEAN, ctx.TRUE_KW() != null ? "true" : "false");
	}

	private Metadata metadataOf(FbsParser.MetadataContext ctx)
	{
		return ctx == null ? Metadata.EMPTY : visitMetadata(ctx);
	}

	/**
	 * Collects the {@code ///} lines immediately preceding the construct.
	 */
	private DocComment docCommentOf(ParserRuleContext ctx)
	{
		List<Token> hidden = tokens.getHiddenTokensToLeft(ctx.start.getTokenIndex(), SchemaLexer.DOC_CHANNEL);
		if (hidden == null || hidden.isEmpty())
		{
			return DocComment.NONE;
		}
		List<String> lines = new ArrayList<>();
		for (Token token : hidden)
		{
			lines.add(token.getText().substring(3));
		}
		return new DocComment(lines);
	}

	private SourcePosition position(Token token)
	{
		return new SourcePosition(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
	}

	private static String unquote(TerminalNode node)
	{
		return StringEscapes.unescape(node.getText().substring(1, node.getText().length() - 1));
	}
}
