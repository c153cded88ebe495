package org.lokray.fbs.semantic;

import org.lokray.fbs.ast.Attribute;
import org.lokray.fbs.ast.Declaration;
import org.lokray.fbs.ast.DeclarationVisitor;
import org.lokray.fbs.ast.Directive;
import org.lokray.fbs.ast.EnumDeclaration;
import org.lokray.fbs.ast.EnumValueNode;
import org.lokray.fbs.ast.FieldNode;
import org.lokray.fbs.ast.Literal;
import org.lokray.fbs.ast.Metadata;
import org.lokray.fbs.ast.RpcMethodNode;
import org.lokray.fbs.ast.RpcServiceDeclaration;
import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.ast.ScalarTypeNode;
import org.lokray.fbs.ast.Schema;
import org.lokray.fbs.ast.StructDeclaration;
import org.lokray.fbs.ast.TableDeclaration;
import org.lokray.fbs.ast.UnionDeclaration;
import org.lokray.fbs.ast.UnionVariantNode;
import org.lokray.fbs.diagnostic.SemanticError;
import org.lokray.fbs.diagnostic.SourcePosition;
import org.lokray.fbs.ir.IrDeclaration;
import org.lokray.fbs.ir.IrEnum;
import org.lokray.fbs.ir.IrEnumValue;
import org.lokray.fbs.ir.IrField;
import org.lokray.fbs.ir.IrRpcMethod;
import org.lokray.fbs.ir.IrRpcService;
import org.lokray.fbs.ir.IrStruct;
import org.lokray.fbs.ir.IrStructField;
import org.lokray.fbs.ir.IrTable;
import org.lokray.fbs.ir.IrUnion;
import org.lokray.fbs.ir.IrUnionVariant;
import org.lokray.fbs.ir.ScalarValue;
import org.lokray.fbs.ir.SchemaIr;
import org.lokray.fbs.ir.StreamingMode;
import org.lokray.fbs.ir.types.IrType;
import org.lokray.fbs.ir.types.NamedType;
import org.lokray.fbs.util.Debug;
import org.lokray.fbs.util.ErrorHandler;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pass 2: validates every declaration of the symbol table and lowers it to
 * the IR. Declarations are processed in dependency order (enums, unions,
 * structs, tables, services) so that table defaults can use enum values and
 * nested structs are laid out before their containers. All errors of the unit
 * are reported before giving up.
 */
public class IrBuilder
{
	// --- Attribute names ---
	public static final String ATTR_ID = "id";
	public static final String ATTR_DEPRECATED = "deprecated";
	public static final String ATTR_REQUIRED = "required";
	public static final String ATTR_KEY = "key";
	public static final String ATTR_FORCE_ALIGN = "force_align";
	public static final String ATTR_STREAMING = "streaming";

	// Attributes flatc understands without an `attribute` declaration.
	private static final Set<String> BUILT_IN_ATTRIBUTES = Set.of(
			ATTR_ID, ATTR_DEPRECATED, ATTR_REQUIRED, ATTR_KEY, ATTR_FORCE_ALIGN, ATTR_STREAMING,
			"bit_flags", "nested_flatbuffer", "flexbuffer", "hash", "original_order", "idempotent",
			"native_inline", "native_default", "native_custom_alloc", "native_type", "shared", "private");

	private final SymbolTable symbols;
	private final ErrorHandler errorHandler;
	private final TypeResolver typeResolver;
	private final DefaultValueConverter defaultValueConverter;
	private final GeneratedNameChecker generatedNames;
	private final IrDeclaration[] built;

	public IrBuilder(SymbolTable symbols, ErrorHandler errorHandler)
	{
		this.symbols = symbols;
		this.errorHandler = errorHandler;
		this.typeResolver = new TypeResolver(symbols, errorHandler);
		this.defaultValueConverter = new DefaultValueConverter(errorHandler);
		this.generatedNames = new GeneratedNameChecker(errorHandler);
		this.built = new IrDeclaration[symbols.size()];
	}

	/**
	 * @param root the root schema; only its root_type, file_identifier and file_extension count.
	 * @return the IR, or {@code null} if any error was reported during this pass.
	 */
	public SchemaIr build(Schema root)
	{
		int errorsBefore = errorHandler.errorCount();
		List<Declaration> declarations = symbols.getDeclarations();

		checkAttributes(declarations);

		for (int id = 0; id < declarations.size(); id++)
		{
			if (declarations.get(id) instanceof EnumDeclaration enumDeclaration)
			{
				built[id] = buildEnum(id, enumDeclaration);
			}
		}
		for (int id = 0; id < declarations.size(); id++)
		{
			if (declarations.get(id) instanceof UnionDeclaration union)
			{
				built[id] = buildUnion(id, union);
			}
		}
		buildStructs(declarations);
		for (int id = 0; id < declarations.size(); id++)
		{
			if (declarations.get(id) instanceof TableDeclaration table)
			{
				built[id] = buildTable(id, table);
			}
		}
		for (int id = 0; id < declarations.size(); id++)
		{
			if (declarations.get(id) instanceof RpcServiceDeclaration service)
			{
				built[id] = buildRpcService(id, service);
			}
		}

		Integer rootTypeId = resolveRootType(root);
		String fileIdentifier = checkFileIdentifier(root);
		String fileExtension = lastDirective(root, Directive.Kind.FILE_EXTENSION).map(Directive::getValue).orElse(null);

		if (errorHandler.errorCount() > errorsBefore)
		{
			return null;
		}
		return new SchemaIr(root.getSourceName(), List.of(built), rootTypeId, fileIdentifier, fileExtension, symbols.getDeclaredAttributes());
	}

	// --- Enums ---

	private IrEnum buildEnum(int id, EnumDeclaration declaration)
	{
		ScalarKind underlying = TypeResolver.underlyingOf(declaration);
		if (!(declaration.getUnderlyingType() instanceof ScalarTypeNode scalar) || !scalar.getKind().isIntegral())
		{
			report(declaration.getPosition(), SemanticError.Kind.INVALID_ENUM,
					"Underlying type of enum " + declaration.getFullyQualifiedName() + " must be an integral scalar, not "
							+ declaration.getUnderlyingType().toSchemaString());
		}

		List<IrEnumValue> values = new ArrayList<>();
		BigInteger previous = null;
		for (EnumValueNode valueNode : declaration.getValues())
		{
			BigInteger value;
			if (valueNode.getValue() != null)
			{
				try
				{
					value = DefaultValueConverter.parseInteger(valueNode.getValue().getText());
				}
				catch (NumberFormatException e)
				{
					report(valueNode.getPosition(), SemanticError.Kind.INVALID_ENUM, "Malformed enum value " + valueNode.getValue().getText());
					continue;
				}
			}
			else
			{
				value = previous == null ? BigInteger.ZERO : previous.add(BigInteger.ONE);
			}

			if (previous != null && value.compareTo(previous) <= 0)
			{
				report(valueNode.getPosition(), SemanticError.Kind.INVALID_ENUM,
						"Enum value " + valueNode.getName() + " = " + value + " of " + declaration.getFullyQualifiedName()
								+ " must be greater than the previous value " + previous);
			}
			if (!underlying.fits(value))
			{
				report(valueNode.getPosition(), SemanticError.Kind.INVALID_ENUM,
						"Enum value " + valueNode.getName() + " = " + value + " does not fit in " + underlying.getKeyword());
			}
			values.add(new IrEnumValue(valueNode.getName(), value.longValue(), valueNode.getDoc().getLines()));
			previous = value;
		}

		return new IrEnum(id, declaration.getName(), declaration.getNamespace(), underlying, values,
				declaration.getDoc().getLines(), attributesOf(declaration.getMetadata()), declaration.getPosition());
	}

	// --- Unions ---

	private IrUnion buildUnion(int id, UnionDeclaration declaration)
	{
		Scope scope = Scope.of(declaration.getNamespace());
		List<IrUnionVariant> variants = new ArrayList<>();
		int value = 1;
		for (UnionVariantNode variantNode : declaration.getVariants())
		{
			Optional<NamedType> type = typeResolver.resolveNamed(variantNode.getTypeName(), scope, variantNode.getPosition());
			if (type.isPresent() && !type.get().isTable())
			{
				report(variantNode.getPosition(), SemanticError.Kind.INVALID_FIELD_TYPE,
						"Union " + declaration.getFullyQualifiedName() + " variant '" + variantNode.getName() + "' must be a table, not "
								+ type.get().getFullyQualifiedName());
			}
			else if (type.isPresent())
			{
				variants.add(new IrUnionVariant(variantNode.getName(), value, type.get(), variantNode.getDoc().getLines()));
			}
			value++;
		}
		if (value - 1 > 255)
		{
			report(declaration.getPosition(), SemanticError.Kind.INVALID_ENUM,
					"Union " + declaration.getFullyQualifiedName() + " has more than 255 variants");
		}
		return new IrUnion(id, declaration.getName(), declaration.getNamespace(), variants,
				declaration.getDoc().getLines(), attributesOf(declaration.getMetadata()), declaration.getPosition());
	}

	// --- Structs ---

	private void buildStructs(List<Declaration> declarations)
	{
		StructLayoutCalculator calculator = new StructLayoutCalculator(errorHandler);
		Map<Integer, List<FieldNode>> validFields = new LinkedHashMap<>();
		Map<Integer, List<IrType>> validTypes = new HashMap<>();

		for (int id = 0; id < declarations.size(); id++)
		{
			if (!(declarations.get(id) instanceof StructDeclaration struct))
			{
				continue;
			}
			Scope scope = Scope.of(struct.getNamespace());
			List<FieldNode> fields = new ArrayList<>();
			List<IrType> types = new ArrayList<>();
			for (FieldNode field : struct.getFields())
			{
				IrType type = typeResolver.resolve(field.getType(), scope, field.getPosition());
				if (type == null)
				{
					continue;
				}
				boolean inline = IrType.wireScalarOf(type) != null || (type instanceof NamedType named && named.isStruct());
				if (!inline)
				{
					report(field.getPosition(), SemanticError.Kind.INVALID_FIELD_TYPE,
							"Struct " + struct.getFullyQualifiedName() + " field '" + field.getName() + "' has type " + type.getDisplayName()
									+ "; structs may only contain scalars, enums and structs");
					continue;
				}
				if (field.getDefaultValue() != null)
				{
					report(field.getPosition(), SemanticError.Kind.INVALID_DEFAULT_FOR_TYPE,
							"Struct field '" + field.getName() + "' of " + struct.getFullyQualifiedName() + " cannot have a default value");
				}
				fields.add(field);
				types.add(type);
			}
			generatedNames.check(struct.getFullyQualifiedName(), fields, types, false);
			validFields.put(id, fields);
			validTypes.put(id, types);
			calculator.addStruct(id, struct.getFullyQualifiedName(), struct.getPosition(), types, forceAlignOf(struct));
		}

		Set<Integer> cyclic = calculator.detectCycles();
		for (Map.Entry<Integer, List<FieldNode>> entry : validFields.entrySet())
		{
			int id = entry.getKey();
			if (cyclic.contains(id) || dependsOnCycle(id, validTypes, cyclic))
			{
				continue;
			}
			StructDeclaration struct = (StructDeclaration) declarations.get(id);
			StructLayoutCalculator.Layout layout = calculator.layout(id);
			List<IrStructField> irFields = new ArrayList<>();
			List<FieldNode> fields = entry.getValue();
			for (int i = 0; i < fields.size(); i++)
			{
				FieldNode field = fields.get(i);
				irFields.add(new IrStructField(field.getName(), validTypes.get(id).get(i), layout.getOffset(i),
						layout.getFieldSize(i), layout.getPadding(i), field.getDoc().getLines()));
			}
			built[id] = new IrStruct(id, struct.getName(), struct.getNamespace(), irFields, layout.getSize(), layout.getAlignment(),
					struct.getDoc().getLines(), attributesOf(struct.getMetadata()), struct.getPosition());
		}
	}

	private boolean dependsOnCycle(int id, Map<Integer, List<IrType>> types, Set<Integer> cyclic)
	{
		for (IrType type : types.get(id))
		{
			if (type instanceof NamedType named && named.isStruct())
			{
				int nested = named.getDeclarationId();
				if (cyclic.contains(nested) || dependsOnCycle(nested, types, cyclic))
				{
					return true;
				}
			}
		}
		return false;
	}

	private int forceAlignOf(StructDeclaration struct)
	{
		Optional<Attribute> attribute = struct.getMetadata().get(ATTR_FORCE_ALIGN);
		if (attribute.isEmpty())
		{
			return 0;
		}
		Literal value = attribute.get().getValue();
		if (value != null && value.getKind() == Literal.Kind.INTEGER)
		{
			try
			{
				long align = DefaultValueConverter.parseInteger(value.getText()).longValueExact();
				if (StructLayoutCalculator.isValidForceAlign(align))
				{
					return (int) align;
				}
			}
			catch (NumberFormatException | ArithmeticException e)
			{
				Debug.logDebug("Unparseable force_align on " + struct.getFullyQualifiedName() + ": " + e.getMessage());
			}
		}
		report(struct.getPosition(), SemanticError.Kind.UNKNOWN_ATTRIBUTE_VALUE,
				"force_align of struct " + struct.getFullyQualifiedName() + " must be a power of two between 1 and "
						+ StructLayoutCalculator.MAX_FORCE_ALIGN + ", got " + value);
		return 0;
	}

	// --- Tables ---

	private IrTable buildTable(int id, TableDeclaration table)
	{
		Scope scope = Scope.of(table.getNamespace());
		List<FieldNode> fields = table.getFields();
		List<IrType> types = new ArrayList<>();
		for (FieldNode field : fields)
		{
			types.add(typeResolver.resolve(field.getType(), scope, field.getPosition()));
		}
		generatedNames.check(table.getFullyQualifiedName(), fields, types, true);

		int[] slots = assignSlots(table, types);
		List<IrField> irFields = new ArrayList<>();
		String keyField = null;
		for (int i = 0; i < fields.size(); i++)
		{
			FieldNode field = fields.get(i);
			IrType type = types.get(i);
			if (type == null)
			{
				continue;
			}
			Metadata metadata = field.getMetadata();
			boolean required = metadata.has(ATTR_REQUIRED);
			boolean key = metadata.has(ATTR_KEY);

			if (required && IrType.wireScalarOf(type) != null)
			{
				report(field.getPosition(), SemanticError.Kind.INVALID_FIELD_TYPE,
						"Scalar field '" + field.getName() + "' of " + table.getFullyQualifiedName() + " cannot be required");
			}
			if (key)
			{
				if (keyField != null)
				{
					report(field.getPosition(), SemanticError.Kind.DUPLICATE_MEMBER,
							"Table " + table.getFullyQualifiedName() + " already has key field '" + keyField + "'");
				}
				keyField = field.getName();
			}

			ScalarValue defaultValue = defaultFor(field, type);
			irFields.add(new IrField(field.getName(), type, slots == null ? -1 : slots[i], defaultValue, required,
					metadata.has(ATTR_DEPRECATED), key, field.getDoc().getLines(), attributesOf(metadata)));
		}

		return new IrTable(id, table.getName(), table.getNamespace(), irFields,
				table.getDoc().getLines(), attributesOf(table.getMetadata()), table.getPosition());
	}

	private ScalarValue defaultFor(FieldNode field, IrType type)
	{
		Literal literal = field.getDefaultValue();
		ScalarKind scalar = IrType.wireScalarOf(type);
		if (scalar == null)
		{
			if (literal != null)
			{
				report(field.getPosition(), SemanticError.Kind.INVALID_DEFAULT_FOR_TYPE,
						"Field '" + field.getName() + "' of type " + type.getDisplayName() + " cannot have a default value");
			}
			return null;
		}
		if (literal == null)
		{
			return ScalarValue.zero(scalar);
		}
		if (type instanceof NamedType named && built[named.getDeclarationId()] instanceof IrEnum irEnum)
		{
			return defaultValueConverter.convertEnum(literal, irEnum, field.getPosition(), field.getName());
		}
		return defaultValueConverter.convert(literal, scalar, field.getPosition(), field.getName());
	}

	/**
	 * Value slot per field. Union fields take the slot before their value slot
	 * for the discriminant. Ids are either given on every field or on none, and
	 * must cover 0..n-1 exactly.
	 *
	 * @return slots by field index, or {@code null} after an id error.
	 */
	private int[] assignSlots(TableDeclaration table, List<IrType> types)
	{
		List<FieldNode> fields = table.getFields();
		int[] slots = new int[fields.size()];
		long withId = fields.stream().filter(f -> f.getMetadata().has(ATTR_ID)).count();

		if (withId == 0)
		{
			int next = 0;
			for (int i = 0; i < fields.size(); i++)
			{
				if (isUnion(types.get(i)))
				{
					next++;
				}
				slots[i] = next++;
			}
			return slots;
		}

		if (withId != fields.size())
		{
			report(table.getPosition(), SemanticError.Kind.DUPLICATE_OR_GAPPED_FIELD_ID,
					"Table " + table.getFullyQualifiedName() + ": either all fields or none must have an explicit id");
			return null;
		}

		TreeMap<Integer, String> used = new TreeMap<>();
		boolean ok = true;
		for (int i = 0; i < fields.size(); i++)
		{
			FieldNode field = fields.get(i);
			Literal value = field.getMetadata().get(ATTR_ID).map(Attribute::getValue).orElse(null);
			Integer slot = parseId(value);
			if (slot == null)
			{
				report(field.getPosition(), SemanticError.Kind.UNKNOWN_ATTRIBUTE_VALUE,
						"id of field '" + field.getName() + "' must be a non-negative integer, got " + value);
				ok = false;
				continue;
			}
			slots[i] = slot;
			ok &= claimSlot(used, slot, field, table);
			if (isUnion(types.get(i)))
			{
				if (slot == 0)
				{
					report(field.getPosition(), SemanticError.Kind.DUPLICATE_OR_GAPPED_FIELD_ID,
							"Union field '" + field.getName() + "' needs id >= 1; its type field takes id - 1");
					ok = false;
				}
				else
				{
					ok &= claimSlot(used, slot - 1, field, table);
				}
			}
		}
		if (!ok)
		{
			return null;
		}

		int expected = 0;
		for (Integer slot : used.keySet())
		{
			if (slot != expected)
			{
				report(table.getPosition(), SemanticError.Kind.DUPLICATE_OR_GAPPED_FIELD_ID,
						"Table " + table.getFullyQualifiedName() + ": field ids must be contiguous from 0, id " + expected + " is missing");
				return null;
			}
			expected++;
		}
		return slots;
	}

	private boolean claimSlot(Map<Integer, String> used, int slot, FieldNode field, TableDeclaration table)
	{
		String previous = used.putIfAbsent(slot, field.getName());
		if (previous != null)
		{
			report(field.getPosition(), SemanticError.Kind.DUPLICATE_OR_GAPPED_FIELD_ID,
					"Table " + table.getFullyQualifiedName() + ": id " + slot + " of field '" + field.getName()
							+ "' is already used by '" + previous + "'");
			return false;
		}
		return true;
	}

	private static Integer parseId(Literal value)
	{
		if (value == null || value.getKind() != Literal.Kind.INTEGER)
		{
			return null;
		}
		try
		{
			BigInteger id = DefaultValueConverter.parseInteger(value.getText());
			if (id.signum() < 0 || id.bitLength() > 16)
			{
				return null;
			}
			return id.intValue();
		}
		catch (NumberFormatException e)
		{
			return null;
		}
	}

	private static boolean isUnion(IrType type)
	{
		return type instanceof NamedType named && named.isUnion();
	}

	// --- RPC services ---

	private IrRpcService buildRpcService(int id, RpcServiceDeclaration service)
	{
		Scope scope = Scope.of(service.getNamespace());
		List<IrRpcMethod> methods = new ArrayList<>();
		for (RpcMethodNode method : service.getMethods())
		{
			NamedType request = rpcTable(method.getRequestType(), scope, method, "request");
			NamedType response = rpcTable(method.getResponseType(), scope, method, "response");
			StreamingMode streaming = streamingOf(method);
			if (request != null && response != null && streaming != null)
			{
				methods.add(new IrRpcMethod(method.getName(), request, response, streaming,
						method.getDoc().getLines(), attributesOf(method.getMetadata())));
			}
		}
		return new IrRpcService(id, service.getName(), service.getNamespace(), methods,
				service.getDoc().getLines(), attributesOf(service.getMetadata()), service.getPosition());
	}

	private NamedType rpcTable(String name, Scope scope, RpcMethodNode method, String role)
	{
		Optional<Integer> id = typeResolver.resolveReference(name, scope, method.getPosition(),
				"Cannot resolve " + role + " type '" + name + "' of rpc method " + method.getName());
		if (id.isEmpty())
		{
			return null;
		}
		Declaration declaration = symbols.get(id.get());
		if (!(declaration instanceof TableDeclaration))
		{
			report(method.getPosition(), SemanticError.Kind.NON_TABLE_RPC_TYPE,
					"The " + role + " type of rpc method " + method.getName() + " must be a table, but "
							+ declaration.getFullyQualifiedName() + " is a " + declaration.getKeyword());
			return null;
		}
		return NamedType.of(NamedType.Kind.TABLE, id.get(), declaration.getFullyQualifiedName());
	}

	private StreamingMode streamingOf(RpcMethodNode method)
	{
		Optional<Attribute> attribute = method.getMetadata().get(ATTR_STREAMING);
		if (attribute.isEmpty())
		{
			return StreamingMode.NONE;
		}
		Literal value = attribute.get().getValue();
		Optional<StreamingMode> mode = value == null ? Optional.empty() : StreamingMode.fromAttributeValue(value.getText());
		if (mode.isEmpty())
		{
			report(method.getPosition(), SemanticError.Kind.UNKNOWN_ATTRIBUTE_VALUE,
					"streaming of rpc method " + method.getName() + " must be one of \"none\", \"server\", \"client\", \"bidi\", got " + value);
			return null;
		}
		return mode.get();
	}

	// --- File-level directives ---

	private Integer resolveRootType(Schema root)
	{
		Optional<Directive> directive = lastDirective(root, Directive.Kind.ROOT_TYPE);
		if (directive.isEmpty())
		{
			return null;
		}
		Directive rootType = directive.get();
		Optional<Integer> id = typeResolver.resolveReference(rootType.getValue(), Scope.of(rootType.getNamespace()),
				rootType.getPosition(), "Cannot resolve root_type '" + rootType.getValue() + "'");
		if (id.isEmpty())
		{
			return null;
		}
		if (!(symbols.get(id.get()) instanceof TableDeclaration))
		{
			report(rootType.getPosition(), SemanticError.Kind.INVALID_ROOT_TYPE,
					"root_type must be a table, but " + symbols.get(id.get()) + " is not");
			return null;
		}
		return id.get();
	}

	private String checkFileIdentifier(Schema root)
	{
		Optional<Directive> directive = lastDirective(root, Directive.Kind.FILE_IDENTIFIER);
		if (directive.isEmpty())
		{
			return null;
		}
		String identifier = directive.get().getValue();
		if (identifier.getBytes(StandardCharsets.UTF_8).length != 4)
		{
			report(directive.get().getPosition(), SemanticError.Kind.INVALID_FILE_IDENTIFIER,
					"file_identifier must be exactly 4 bytes, got \"" + identifier + "\"");
			return null;
		}
		return identifier;
	}

	private static Optional<Directive> lastDirective(Schema schema, Directive.Kind kind)
	{
		List<Directive> directives = schema.getDirectives(kind);
		return directives.isEmpty() ? Optional.empty() : Optional.of(directives.get(directives.size() - 1));
	}

	// --- Attributes ---

	private void checkAttributes(List<Declaration> declarations)
	{
		DeclarationVisitor<List<Metadata>> collector = new MetadataCollector();
		for (Declaration declaration : declarations)
		{
			for (Metadata metadata : declaration.accept(collector))
			{
				for (Attribute attribute : metadata.getAttributes())
				{
					if (!BUILT_IN_ATTRIBUTES.contains(attribute.getName()) && !symbols.isDeclaredAttribute(attribute.getName()))
					{
						Debug.logWarning("Attribute '" + attribute.getName() + "' used in " + declaration
								+ " is neither built in nor declared with 'attribute'.");
					}
				}
			}
		}
	}

	private static Map<String, String> attributesOf(Metadata metadata)
	{
		Map<String, String> attributes = new LinkedHashMap<>();
		for (Attribute attribute : metadata.getAttributes())
		{
			attributes.putIfAbsent(attribute.getName(), attribute.getValue() == null ? "" : attribute.getValue().getText());
		}
		return attributes;
	}

	private void report(SourcePosition position, SemanticError.Kind kind, String message)
	{
		errorHandler.report(new SemanticError(position, kind, message));
	}

	/**
	 * Every metadata list attached to a declaration or one of its members.
	 */
	private static final class MetadataCollector implements DeclarationVisitor<List<Metadata>>
	{
		@Override
		public List<Metadata> visitEnum(EnumDeclaration declaration)
		{
			List<Metadata> result = new ArrayList<>(List.of(declaration.getMetadata()));
			declaration.getValues().forEach(v -> result.add(v.getMetadata()));
			return result;
		}

		@Override
		public List<Metadata> visitUnion(UnionDeclaration declaration)
		{
			List<Metadata> result = new ArrayList<>(List.of(declaration.getMetadata()));
			declaration.getVariants().forEach(v -> result.add(v.getMetadata()));
			return result;
		}

		@Override
		public List<Metadata> visitStruct(StructDeclaration declaration)
		{
			List<Metadata> result = new ArrayList<>(List.of(declaration.getMetadata()));
			declaration.getFields().forEach(f -> result.add(f.getMetadata()));
			return result;
		}

		@Override
		public List<Metadata> visitTable(TableDeclaration declaration)
		{
			List<Metadata> result = new ArrayList<>(List.of(declaration.getMetadata()));
			declaration.getFields().forEach(f -> result.add(f.getMetadata()));
			return result;
		}

		@Override
		public List<Metadata> visitRpcService(RpcServiceDeclaration declaration)
		{
			List<Metadata> result = new ArrayList<>(List.of(declaration.getMetadata()));
			declaration.getMethods().forEach(m -> result.add(m.getMetadata()));
			return result;
		}
	}
}
