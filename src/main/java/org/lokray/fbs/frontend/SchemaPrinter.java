package org.lokray.fbs.frontend;

import org.lokray.fbs.ast.Attribute;
import org.lokray.fbs.ast.Declaration;
import org.lokray.fbs.ast.DeclarationVisitor;
import org.lokray.fbs.ast.Directive;
import org.lokray.fbs.ast.DocComment;
import org.lokray.fbs.ast.EnumDeclaration;
import org.lokray.fbs.ast.EnumValueNode;
import org.lokray.fbs.ast.FieldNode;
import org.lokray.fbs.ast.Literal;
import org.lokray.fbs.ast.Metadata;
import org.lokray.fbs.ast.RpcMethodNode;
import org.lokray.fbs.ast.RpcServiceDeclaration;
import org.lokray.fbs.ast.Schema;
import org.lokray.fbs.ast.SchemaElement;
import org.lokray.fbs.ast.StructDeclaration;
import org.lokray.fbs.ast.TableDeclaration;
import org.lokray.fbs.ast.UnionDeclaration;
import org.lokray.fbs.ast.UnionVariantNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an AST back to schema text. Parsing the output yields an AST equal
 * to the input; layout and ordinary comments are not preserved.
 */
public class SchemaPrinter implements DeclarationVisitor<Void>
{
	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();

	public static String print(Schema schema)
	{
		SchemaPrinter printer = new SchemaPrinter();
		for (SchemaElement element : schema.getElements())
		{
			if (element instanceof Directive directive)
			{
				printer.printDirective(directive);
			}
			else
			{
				((Declaration) element).accept(printer);
			}
		}
		return printer.out.toString();
	}

	private void printDirective(Directive directive)
	{
		if (directive.getKind() == Directive.Kind.NAMESPACE && directive.getValue().isEmpty())
		{
			out.append("namespace;\n");
			return;
		}
		out.append(directive.getKind().getKeyword()).append(' ');
		if (directive.getKind().isQuoted() || directive.getKind() == Directive.Kind.ATTRIBUTE)
		{
			out.append('"').append(StringEscapes.escape(directive.getValue())).append('"');
		}
		else
		{
			out.append(directive.getValue());
		}
		out.append(";\n");
	}

	@Override
	public Void visitEnum(EnumDeclaration declaration)
	{
		printHeader(declaration, " : " + declaration.getUnderlyingType().toSchemaString());
		List<EnumValueNode> values = declaration.getValues();
		for (int i = 0; i < values.size(); i++)
		{
			EnumValueNode value = values.get(i);
			printDoc(value.getDoc(), INDENT);
			out.append(INDENT).append(value.getName());
			if (value.getValue() != null)
			{
				out.append(" = ").append(value.getValue().getText());
			}
			out.append(metadata(value.getMetadata()));
			out.append(i < values.size() - 1 ? ",\n" : "\n");
		}
		out.append("}\n\n");
		return null;
	}

	@Override
	public Void visitUnion(UnionDeclaration declaration)
	{
		printHeader(declaration, "");
		List<UnionVariantNode> variants = declaration.getVariants();
		for (int i = 0; i < variants.size(); i++)
		{
			UnionVariantNode variant = variants.get(i);
			printDoc(variant.getDoc(), INDENT);
			out.append(INDENT);
			if (variant.getAlias() != null)
			{
				out.append(variant.getAlias()).append(": ");
			}
			out.append(variant.getTypeName()).append(metadata(variant.getMetadata()));
			out.append(i < variants.size() - 1 ? ",\n" : "\n");
		}
		out.append("}\n\n");
		return null;
	}

	@Override
	public Void visitStruct(StructDeclaration declaration)
	{
		printHeader(declaration, "");
		declaration.getFields().forEach(this::printField);
		out.append("}\n\n");
		return null;
	}

	@Override
	public Void visitTable(TableDeclaration declaration)
	{
		printHeader(declaration, "");
		declaration.getFields().forEach(this::printField);
		out.append("}\n\n");
		return null;
	}

	@Override
	public Void visitRpcService(RpcServiceDeclaration declaration)
	{
		printHeader(declaration, "");
		for (RpcMethodNode method : declaration.getMethods())
		{
			printDoc(method.getDoc(), INDENT);
			out.append(INDENT).append(method.getName())
					.append('(').append(method.getRequestType()).append("):")
					.append(method.getResponseType())
					.append(metadata(method.getMetadata()))
					.append(";\n");
		}
		out.append("}\n\n");
		return null;
	}

	private void printHeader(Declaration declaration, String afterName)
	{
		printDoc(declaration.getDoc(), "");
		out.append(declaration.getKeyword()).append(' ').append(declaration.getName()).append(afterName)
				.append(metadata(declaration.getMetadata()))
				.append(" {\n");
	}

	private void printField(FieldNode field)
	{
		printDoc(field.getDoc(), INDENT);
		out.append(INDENT).append(field.getName()).append(':').append(field.getType().toSchemaString());
		if (field.getDefaultValue() != null)
		{
			out.append(" = ").append(literal(field.getDefaultValue()));
		}
		out.append(metadata(field.getMetadata())).append(";\n");
	}

	private void printDoc(DocComment doc, String indent)
	{
		for (String line : doc.getLines())
		{
			out.append(indent).append("///").append(line).append('\n');
		}
	}

	private static String metadata(Metadata metadata)
	{
		if (metadata.isEmpty())
		{
			return "";
		}
		return metadata.getAttributes().stream()
				.map(SchemaPrinter::attribute)
				.collect(Collectors.joining(", ", " (", ")"));
	}

	private static String attribute(Attribute attribute)
	{
		return attribute.getValue() == null ? attribute.getName() : attribute.getName() + ": " + literal(attribute.getValue());
	}

	private static String literal(Literal literal)
	{
		return literal.getKind() == Literal.Kind.STRING
				? "\"" + StringEscapes.escape(literal.getText()) + "\""
				: literal.getText();
	}
}
