package org.lokray.fbs.codegen;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;
import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.ir.IrDeclaration;
import org.lokray.fbs.ir.IrDeclarationVisitor;
import org.lokray.fbs.ir.IrEnum;
import org.lokray.fbs.ir.IrEnumValue;
import org.lokray.fbs.ir.IrField;
import org.lokray.fbs.ir.IrRpcService;
import org.lokray.fbs.ir.IrStruct;
import org.lokray.fbs.ir.IrStructField;
import org.lokray.fbs.ir.IrTable;
import org.lokray.fbs.ir.IrUnion;
import org.lokray.fbs.ir.IrUnionVariant;
import org.lokray.fbs.ir.ScalarValue;
import org.lokray.fbs.ir.SchemaIr;
import org.lokray.fbs.ir.types.IrType;
import org.lokray.fbs.ir.types.NamedType;
import org.lokray.fbs.ir.types.StringType;
import org.lokray.fbs.ir.types.VectorType;
import org.lokray.fbs.util.Debug;

import javax.lang.model.SourceVersion;
import javax.lang.model.element.Modifier;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.lokray.fbs.runtime.Constants.SIZEOF_BYTE;
import static org.lokray.fbs.runtime.Constants.SIZEOF_INT;

/**
 * Java backend: one accessor class per enum, union, struct and table, plus
 * the RPC stubs of {@link JavaRpcGenerator}. Accessors read a finished buffer
 * in place through {@code org.lokray.fbs.runtime}; static helpers on each
 * class write new buffers through {@code FlatBufferBuilder}.
 */
public class JavaGenerator implements CodeGenerator
{
	static final String RUNTIME_PACKAGE = "org.lokray.fbs.runtime";
	static final ClassName TABLE = ClassName.get(RUNTIME_PACKAGE, "Table");
	static final ClassName STRUCT = ClassName.get(RUNTIME_PACKAGE, "Struct");
	static final ClassName BUILDER = ClassName.get(RUNTIME_PACKAGE, "FlatBufferBuilder");
	static final ClassName BYTE_BUFFER = ClassName.get(ByteBuffer.class);
	private static final ClassName GENERATED = ClassName.get("javax.annotation.processing", "Generated");

	private final GeneratorOptions options;
	private final JavaNames names;

	public JavaGenerator()
	{
		this(GeneratorOptions.defaults());
	}

	public JavaGenerator(GeneratorOptions options)
	{
		this.options = options;
		this.names = new JavaNames(options);
	}

	@Override
	public String getName()
	{
		return "java";
	}

	@Override
	public List<GeneratedFile> generate(SchemaIr ir)
	{
		List<GeneratedFile> files = new ArrayList<>();
		DeclarationEmitter emitter = new DeclarationEmitter(ir);
		for (IrDeclaration declaration : ir.getDeclarations())
		{
			TypeSpec type = declaration.accept(emitter);
			if (type != null)
			{
				files.add(toFile(names.packageOf(declaration.getNamespace()), type, ir));
			}
		}
		files.addAll(new JavaRpcGenerator(options).generate(ir));
		Debug.logDebug("Java backend produced " + files.size() + " file(s) for " + ir.getSourceName());
		return files;
	}

	GeneratedFile toFile(String packageName, TypeSpec type, SchemaIr ir)
	{
		JavaFile file = JavaFile.builder(packageName, type)
				.addFileComment("Generated by fbsc from $L. Do not edit.", Path.of(ir.getSourceName()).getFileName())
				.indent(options.getIndent())
				.skipJavaLangImports(true)
				.build();
		return new GeneratedFile(JavaNames.sourcePathOf(ClassName.get(packageName, type.name)), file.toString());
	}

	TypeSpec.Builder classBuilder(ClassName name, List<String> doc)
	{
		TypeSpec.Builder builder = TypeSpec.classBuilder(name).addModifiers(Modifier.PUBLIC, Modifier.FINAL);
		addDoc(doc, builder);
		if (options.isGeneratedAnnotation())
		{
			builder.addAnnotation(AnnotationSpec.builder(GENERATED).addMember("value", "$S", "fbsc").build());
		}
		return builder;
	}

	static void addDoc(List<String> doc, TypeSpec.Builder builder)
	{
		for (String line : doc)
		{
			builder.addJavadoc("$L\n", line.strip());
		}
	}

	static void addDoc(List<String> doc, MethodSpec.Builder builder)
	{
		for (String line : doc)
		{
			builder.addJavadoc("$L\n", line.strip());
		}
	}

	private static MethodSpec privateConstructor()
	{
		return MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build();
	}

	private static MethodSpec.Builder publicStatic(String name)
	{
		return MethodSpec.methodBuilder(name).addModifiers(Modifier.PUBLIC, Modifier.STATIC);
	}

	// Parameter names share a scope with the "builder" parameter
	private static String parameterName(String name)
	{
		return name.equals("builder") ? name + "_" : name;
	}

	private final class DeclarationEmitter implements IrDeclarationVisitor<TypeSpec>
	{
		private final SchemaIr ir;

		DeclarationEmitter(SchemaIr ir)
		{
			this.ir = ir;
		}

		// --- Enums ---

		@Override
		public TypeSpec visitEnum(IrEnum irEnum)
		{
			ScalarKind kind = irEnum.getUnderlyingType();
			TypeName javaType = TypeConverter.javaType(kind);
			TypeSpec.Builder type = classBuilder(names.classNameOf(irEnum), irEnum.getDoc())
					.addMethod(privateConstructor());

			CodeBlock.Builder namesInit = CodeBlock.builder().add("{ ");
			CodeBlock.Builder valuesInit = CodeBlock.builder().add("{ ");
			List<IrEnumValue> values = irEnum.getValues();
			for (int i = 0; i < values.size(); i++)
			{
				IrEnumValue value = values.get(i);
				FieldSpec.Builder constant = FieldSpec.builder(javaType, constantIdentifier(value.getName()),
								Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
						.initializer("$L", TypeConverter.literal(ScalarValue.ofLong(kind, value.getValue())));
				for (String line : value.getDoc())
				{
					constant.addJavadoc("$L\n", line.strip());
				}
				type.addField(constant.build());
				String separator = i + 1 < values.size() ? ", " : " ";
				namesInit.add("$S$L", value.getName(), separator);
				valuesInit.add("$LL$L", value.getValue(), separator);
			}

			type.addField(FieldSpec.builder(String[].class, "NAMES", Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
					.initializer(namesInit.add("}").build())
					.build());
			type.addField(FieldSpec.builder(long[].class, "VALUES", Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
					.initializer(valuesInit.add("}").build())
					.build());

			type.addMethod(publicStatic("names")
					.addJavadoc("Value names in declaration order.\n")
					.returns(String[].class)
					.addStatement("return NAMES.clone()")
					.build());
			type.addMethod(publicStatic("name")
					.addJavadoc("Name of {@code value}, or {@code null} if no enumerator has it.\n")
					.returns(String.class)
					.addParameter(long.class, "value")
					.beginControlFlow("for (int i = 0; i < VALUES.length; i++)")
					.beginControlFlow("if (VALUES[i] == value)")
					.addStatement("return NAMES[i]")
					.endControlFlow()
					.endControlFlow()
					.addStatement("return null")
					.build());
			return type.build();
		}

		// --- Unions ---

		@Override
		public TypeSpec visitUnion(IrUnion union)
		{
			ClassName className = ClassName.get(names.packageOf(union.getNamespace()), union.getDiscriminantName());
			TypeSpec.Builder type = classBuilder(className, union.getDoc())
					.addMethod(privateConstructor())
					.addField(FieldSpec.builder(int.class, IrUnion.NONE, Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
							.initializer("0")
							.build());

			CodeBlock.Builder namesInit = CodeBlock.builder().add("{ $S", IrUnion.NONE);
			int next = 1;
			for (IrUnionVariant variant : union.getVariants())
			{
				FieldSpec.Builder constant = FieldSpec.builder(int.class, constantIdentifier(variant.getName()),
								Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
						.initializer("$L", variant.getValue());
				for (String line : variant.getDoc())
				{
					constant.addJavadoc("$L\n", line.strip());
				}
				type.addField(constant.build());
				// Variants dropped by the semantic pass leave holes in the numbering
				for (; next < variant.getValue(); next++)
				{
					namesInit.add(", null");
				}
				namesInit.add(", $S", variant.getName());
				next++;
			}

			type.addField(FieldSpec.builder(String[].class, "NAMES", Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
					.initializer(namesInit.add(" }").build())
					.build());
			type.addMethod(publicStatic("names")
					.returns(String[].class)
					.addStatement("return NAMES.clone()")
					.build());
			type.addMethod(publicStatic("name")
					.returns(String.class)
					.addParameter(int.class, "type")
					.addStatement("return type >= 0 && type < NAMES.length ? NAMES[type] : null")
					.build());
			return type.build();
		}

		// --- Structs ---

		@Override
		public TypeSpec visitStruct(IrStruct struct)
		{
			ClassName className = names.classNameOf(struct);
			TypeSpec.Builder type = classBuilder(className, struct.getDoc())
					.superclass(STRUCT)
					.addField(FieldSpec.builder(int.class, "SIZE", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
							.initializer("$L", struct.getSize())
							.build())
					.addField(FieldSpec.builder(int.class, "ALIGNMENT", Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
							.initializer("$L", struct.getAlignment())
							.build())
					.addMethod(assignMethod(className));

			for (IrStructField field : struct.getFields())
			{
				String member = JavaNames.memberName(field.getName());
				CodeBlock position = CodeBlock.of("bbPos + $L", field.getOffset());
				if (field.getType() instanceof NamedType named && named.isStruct())
				{
					ClassName nested = names.classNameOf(named);
					MethodSpec.Builder getter = MethodSpec.methodBuilder(member)
							.addModifiers(Modifier.PUBLIC)
							.returns(nested)
							.addStatement("return $N(new $T())", member, nested);
					addDoc(field.getDoc(), getter);
					type.addMethod(getter.build());
					type.addMethod(MethodSpec.methodBuilder(member)
							.addModifiers(Modifier.PUBLIC)
							.returns(nested)
							.addParameter(nested, "obj")
							.addStatement("return obj.assign($L, bb)", position)
							.build());
				}
				else
				{
					ScalarKind kind = IrType.wireScalarOf(field.getType());
					MethodSpec.Builder getter = MethodSpec.methodBuilder(member)
							.addModifiers(Modifier.PUBLIC)
							.returns(TypeConverter.javaType(kind))
							.addStatement("return $L", TypeConverter.read(kind, "bb", position));
					addDoc(field.getDoc(), getter);
					type.addMethod(getter.build());
				}
			}

			MethodSpec.Builder create = publicStatic("create" + struct.getName())
					.addJavadoc("Writes a $L inline; add it to its table right after this call.\n", struct.getName())
					.returns(int.class)
					.addParameter(BUILDER, "builder");
			addStructParameters(struct, "", create);
			addStructBody(struct, "", create);
			create.addStatement("return builder.offset()");
			type.addMethod(create.build());
			return type.build();
		}

		private void addStructParameters(IrStruct struct, String prefix, MethodSpec.Builder method)
		{
			for (IrStructField field : struct.getFields())
			{
				String name = prefix.isEmpty() ? JavaNames.memberName(field.getName()) : prefix + JavaNames.upperCamel(field.getName());
				if (field.getType() instanceof NamedType named && named.isStruct())
				{
					addStructParameters(ir.resolve(named, IrStruct.class), name, method);
				}
				else
				{
					method.addParameter(TypeConverter.javaType(IrType.wireScalarOf(field.getType())), parameterName(name));
				}
			}
		}

		// Fields are written last to first, each preceded by the padding that follows it
		private void addStructBody(IrStruct struct, String prefix, MethodSpec.Builder method)
		{
			method.addStatement("builder.prep($L, $L)", struct.getAlignment(), struct.getSize());
			List<IrStructField> fields = struct.getFields();
			for (int i = fields.size() - 1; i >= 0; i--)
			{
				IrStructField field = fields.get(i);
				if (field.getPadding() > 0)
				{
					method.addStatement("builder.pad($L)", field.getPadding());
				}
				String name = prefix.isEmpty() ? JavaNames.memberName(field.getName()) : prefix + JavaNames.upperCamel(field.getName());
				if (field.getType() instanceof NamedType named && named.isStruct())
				{
					addStructBody(ir.resolve(named, IrStruct.class), name, method);
				}
				else
				{
					ScalarKind kind = IrType.wireScalarOf(field.getType());
					method.addStatement("builder.put$L($L$N)", TypeConverter.builderSuffix(kind), TypeConverter.wireCast(kind),
							parameterName(name));
				}
			}
		}

		// --- Tables ---

		@Override
		public TypeSpec visitTable(IrTable table)
		{
			ClassName className = names.classNameOf(table);
			TypeSpec.Builder type = classBuilder(className, table.getDoc()).superclass(TABLE);

			for (IrField field : table.getFields())
			{
				if (field.isUnion())
				{
					type.addField(vtableConstant(field.getName() + "_type", field.getTypeVtableOffset()));
				}
				type.addField(vtableConstant(field.getName(), field.getVtableOffset()));
			}

			String rootMethod = "getRootAs" + table.getName();
			type.addMethod(publicStatic(rootMethod)
					.returns(className)
					.addParameter(BYTE_BUFFER, "buffer")
					.addStatement("return $N(buffer, new $T())", rootMethod, className)
					.build());
			type.addMethod(publicStatic(rootMethod)
					.returns(className)
					.addParameter(BYTE_BUFFER, "buffer")
					.addParameter(className, "obj")
					.addStatement("return obj.assign(rootPosition(buffer), buffer)")
					.build());
			type.addMethod(assignMethod(className));

			for (IrField field : table.getFields())
			{
				if (!field.isDeprecated())
				{
					addAccessors(field, type);
				}
			}

			addBuilderMethods(table, className, type);
			return type.build();
		}

		private FieldSpec vtableConstant(String fieldName, int vtableOffset)
		{
			return FieldSpec.builder(int.class, "VT_" + JavaNames.constantName(fieldName),
							Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
					.initializer("$L", vtableOffset)
					.build();
		}

		private void addAccessors(IrField field, TypeSpec.Builder type)
		{
			String member = JavaNames.memberName(field.getName());
			String vt = "VT_" + JavaNames.constantName(field.getName());
			IrType fieldType = field.getType();
			ScalarKind kind = IrType.wireScalarOf(fieldType);

			if (kind != null)
			{
				ScalarValue defaultValue = field.getDefaultValue() != null ? field.getDefaultValue() : ScalarValue.zero(kind);
				MethodSpec.Builder getter = MethodSpec.methodBuilder(member)
						.addModifiers(Modifier.PUBLIC)
						.returns(TypeConverter.javaType(kind))
						.addStatement("int o = fieldOffset($L)", vt)
						.addStatement("return o != 0 ? $L : $L",
								TypeConverter.read(kind, "bb", CodeBlock.of("o + bbPos")), TypeConverter.literal(defaultValue));
				addDoc(field.getDoc(), getter);
				type.addMethod(getter.build());
			}
			else if (fieldType instanceof StringType)
			{
				MethodSpec.Builder getter = MethodSpec.methodBuilder(member)
						.addModifiers(Modifier.PUBLIC)
						.returns(String.class)
						.addStatement("int o = fieldOffset($L)", vt)
						.addStatement("return o != 0 ? readString(o + bbPos) : null");
				addDoc(field.getDoc(), getter);
				type.addMethod(getter.build());
			}
			else if (fieldType instanceof NamedType named && named.isUnion())
			{
				String typeVt = "VT_" + JavaNames.constantName(field.getName() + "_type");
				type.addMethod(MethodSpec.methodBuilder(member + "Type")
						.addModifiers(Modifier.PUBLIC)
						.returns(int.class)
						.addStatement("int o = fieldOffset($L)", typeVt)
						.addStatement("return o != 0 ? bb.get(o + bbPos) & 0xFF : 0")
						.build());
				TypeVariableName t = TypeVariableName.get("T", TABLE);
				MethodSpec.Builder getter = MethodSpec.methodBuilder(member)
						.addModifiers(Modifier.PUBLIC)
						.addTypeVariable(t)
						.returns(t)
						.addParameter(t, "obj")
						.addStatement("int o = fieldOffset($L)", vt)
						.addStatement("return o != 0 ? unionTable(obj, o) : null");
				addDoc(field.getDoc(), getter);
				type.addMethod(getter.build());
			}
			else if (fieldType instanceof NamedType named)
			{
				ClassName target = names.classNameOf(named);
				String position = named.isStruct() ? "o + bbPos" : "indirect(o + bbPos)";
				MethodSpec.Builder getter = MethodSpec.methodBuilder(member)
						.addModifiers(Modifier.PUBLIC)
						.returns(target)
						.addStatement("return $N(new $T())", member, target);
				addDoc(field.getDoc(), getter);
				type.addMethod(getter.build());
				type.addMethod(MethodSpec.methodBuilder(member)
						.addModifiers(Modifier.PUBLIC)
						.returns(target)
						.addParameter(target, "obj")
						.addStatement("int o = fieldOffset($L)", vt)
						.addStatement("return o != 0 ? obj.assign($L, bb) : null", position)
						.build());
			}
			else if (fieldType instanceof VectorType vector)
			{
				addVectorAccessors(field, member, vt, vector.getElementType(), type);
			}
		}

		private void addVectorAccessors(IrField field, String member, String vt, IrType element, TypeSpec.Builder type)
		{
			type.addMethod(MethodSpec.methodBuilder(member + "Length")
					.addModifiers(Modifier.PUBLIC)
					.returns(int.class)
					.addStatement("int o = fieldOffset($L)", vt)
					.addStatement("return o != 0 ? vectorLength(o) : 0")
					.build());

			ScalarKind kind = IrType.wireScalarOf(element);
			if (kind != null)
			{
				MethodSpec.Builder getter = MethodSpec.methodBuilder(member)
						.addModifiers(Modifier.PUBLIC)
						.returns(TypeConverter.javaType(kind))
						.addParameter(int.class, "j")
						.addStatement("int o = fieldOffset($L)", vt)
						.addStatement("return o != 0 ? $L : $L",
								TypeConverter.read(kind, "bb", CodeBlock.of("vectorStart(o) + j * $L", kind.getSize())),
								TypeConverter.literal(ScalarValue.zero(kind)));
				addDoc(field.getDoc(), getter);
				type.addMethod(getter.build());
			}
			else if (element instanceof StringType)
			{
				MethodSpec.Builder getter = MethodSpec.methodBuilder(member)
						.addModifiers(Modifier.PUBLIC)
						.returns(String.class)
						.addParameter(int.class, "j")
						.addStatement("int o = fieldOffset($L)", vt)
						.addStatement("return o != 0 ? readString(vectorStart(o) + j * $L) : null", SIZEOF_INT);
				addDoc(field.getDoc(), getter);
				type.addMethod(getter.build());
			}
			else if (element instanceof NamedType named)
			{
				ClassName target = names.classNameOf(named);
				CodeBlock position = named.isStruct()
						? CodeBlock.of("vectorStart(o) + j * $T.SIZE", target)
						: CodeBlock.of("indirect(vectorStart(o) + j * $L)", SIZEOF_INT);
				MethodSpec.Builder getter = MethodSpec.methodBuilder(member)
						.addModifiers(Modifier.PUBLIC)
						.returns(target)
						.addParameter(int.class, "j")
						.addStatement("return $N(new $T(), j)", member, target);
				addDoc(field.getDoc(), getter);
				type.addMethod(getter.build());
				type.addMethod(MethodSpec.methodBuilder(member)
						.addModifiers(Modifier.PUBLIC)
						.returns(target)
						.addParameter(target, "obj")
						.addParameter(int.class, "j")
						.addStatement("int o = fieldOffset($L)", vt)
						.addStatement("return o != 0 ? obj.assign($L, bb) : null", position)
						.build());
			}
		}

		// --- Table builders ---

		private void addBuilderMethods(IrTable table, ClassName className, TypeSpec.Builder type)
		{
			String name = table.getName();
			type.addMethod(publicStatic("start" + name)
					.addParameter(BUILDER, "builder")
					.addStatement("builder.startTable($L)", table.getSlotCount())
					.build());

			for (IrField field : table.getFields())
			{
				if (field.isDeprecated())
				{
					continue;
				}
				type.addMethod(addMethod(field));
				if (field.isUnion())
				{
					type.addMethod(addUnionTypeMethod(field));
				}
				if (field.getType() instanceof VectorType vector)
				{
					addVectorBuilders(field, vector.getElementType(), type);
				}
			}

			MethodSpec.Builder end = publicStatic("end" + name)
					.returns(int.class)
					.addParameter(BUILDER, "builder")
					.addStatement("int o = builder.endTable()");
			for (IrField field : table.getFields())
			{
				if (field.isRequired())
				{
					end.addStatement("builder.required(o, VT_$L, $S)", JavaNames.constantName(field.getName()), field.getName());
				}
			}
			type.addMethod(end.addStatement("return o").build());

			if (!table.hasStructFields())
			{
				type.addMethod(createMethod(table));
			}

			ir.getRootType().filter(root -> root.getId() == table.getId()).ifPresent(root -> addRootMethods(className, type));
		}

		private MethodSpec addMethod(IrField field)
		{
			String member = JavaNames.memberName(field.getName());
			ScalarKind kind = IrType.wireScalarOf(field.getType());
			MethodSpec.Builder add = publicStatic("add" + JavaNames.upperCamel(field.getName()))
					.addParameter(BUILDER, "builder");
			if (kind != null)
			{
				ScalarValue defaultValue = field.getDefaultValue() != null ? field.getDefaultValue() : ScalarValue.zero(kind);
				String parameter = parameterName(member);
				add.addParameter(TypeConverter.javaType(kind), parameter)
						.addStatement("builder.add$L($L, $L$N, $L)", TypeConverter.builderSuffix(kind), field.getSlot(),
								TypeConverter.wireCast(kind), parameter, TypeConverter.wireLiteral(defaultValue));
			}
			else
			{
				String method = field.getType() instanceof NamedType named && named.isStruct() ? "addStruct" : "addOffset";
				add.addParameter(int.class, member + "Offset")
						.addStatement("builder.$L($L, $N, 0)", method, field.getSlot(), member + "Offset");
			}
			return add.build();
		}

		private MethodSpec addUnionTypeMethod(IrField field)
		{
			String parameter = JavaNames.memberName(field.getName()) + "Type";
			return publicStatic("add" + JavaNames.upperCamel(field.getName()) + "Type")
					.addParameter(BUILDER, "builder")
					.addParameter(int.class, parameter)
					.addStatement("builder.addByte($L, (byte) $N, 0)", field.getTypeSlot(), parameter)
					.build();
		}

		private void addVectorBuilders(IrField field, IrType element, TypeSpec.Builder type)
		{
			String upper = JavaNames.upperCamel(field.getName());
			ScalarKind kind = IrType.wireScalarOf(element);
			int elementSize;
			int alignment;
			if (kind != null)
			{
				elementSize = kind.getSize();
				alignment = kind.getSize();
				type.addMethod(publicStatic("create" + upper + "Vector")
						.returns(int.class)
						.addParameter(BUILDER, "builder")
						.addParameter(TypeConverter.javaArrayType(kind), "data")
						.addStatement("builder.startVector($L, data.length, $L)", elementSize, alignment)
						.beginControlFlow("for (int i = data.length - 1; i >= 0; i--)")
						.addStatement("builder.add$L($Ldata[i])", TypeConverter.builderSuffix(kind), TypeConverter.wireCast(kind))
						.endControlFlow()
						.addStatement("return builder.endVector()")
						.build());
			}
			else if (element instanceof NamedType named && named.isStruct())
			{
				IrStruct struct = ir.resolve(named, IrStruct.class);
				elementSize = struct.getSize();
				alignment = struct.getAlignment();
			}
			else
			{
				elementSize = SIZEOF_INT;
				alignment = SIZEOF_INT;
				type.addMethod(publicStatic("create" + upper + "Vector")
						.returns(int.class)
						.addParameter(BUILDER, "builder")
						.addParameter(int[].class, "data")
						.addStatement("return builder.createVectorOfOffsets(data)")
						.build());
			}
			type.addMethod(publicStatic("start" + upper + "Vector")
					.addParameter(BUILDER, "builder")
					.addParameter(int.class, "numElements")
					.addStatement("builder.startVector($L, numElements, $L)", elementSize, alignment)
					.build());
		}

		// Largest fields first so the table needs no padding between them
		private MethodSpec createMethod(IrTable table)
		{
			String name = table.getName();
			MethodSpec.Builder create = publicStatic("create" + name)
					.returns(int.class)
					.addParameter(BUILDER, "builder");
			List<IrField> fields = table.getFields().stream().filter(f -> !f.isDeprecated()).toList();
			for (IrField field : fields)
			{
				String member = JavaNames.memberName(field.getName());
				ScalarKind kind = IrType.wireScalarOf(field.getType());
				if (field.isUnion())
				{
					create.addParameter(int.class, member + "Type");
				}
				if (kind != null)
				{
					create.addParameter(TypeConverter.javaType(kind), parameterName(member));
				}
				else
				{
					create.addParameter(int.class, member + "Offset");
				}
			}

			create.addStatement("builder.startTable($L)", table.getSlotCount());
			for (int size : new int[]{8, 4, 2, 1})
			{
				for (int i = fields.size() - 1; i >= 0; i--)
				{
					IrField field = fields.get(i);
					String upper = JavaNames.upperCamel(field.getName());
					String member = JavaNames.memberName(field.getName());
					ScalarKind kind = IrType.wireScalarOf(field.getType());
					if (kind != null)
					{
						if (kind.getSize() == size)
						{
							create.addStatement("$N.add$L(builder, $N)", name, upper, parameterName(member));
						}
					}
					else if (size == SIZEOF_INT)
					{
						create.addStatement("$N.add$L(builder, $N)", name, upper, member + "Offset");
					}
					if (field.isUnion() && size == SIZEOF_BYTE)
					{
						create.addStatement("$N.add$LType(builder, $N)", name, upper, member + "Type");
					}
				}
			}
			return create.addStatement("return $N.end$L(builder)", name, name).build();
		}

		private void addRootMethods(ClassName className, TypeSpec.Builder type)
		{
			String name = className.simpleName();
			MethodSpec.Builder finish = publicStatic("finish" + name + "Buffer")
					.addParameter(BUILDER, "builder")
					.addParameter(int.class, "offset");
			if (ir.getFileIdentifier().isPresent())
			{
				String identifier = ir.getFileIdentifier().get();
				finish.addStatement("builder.finish(offset, $S)", identifier);
				type.addMethod(publicStatic(name + "BufferHasIdentifier")
						.returns(boolean.class)
						.addParameter(BYTE_BUFFER, "buffer")
						.addStatement("return hasIdentifier(buffer, $S)", identifier)
						.build());
			}
			else
			{
				finish.addStatement("builder.finish(offset)");
			}
			type.addMethod(finish.build());
		}

		// --- Services ---

		@Override
		public TypeSpec visitRpcService(IrRpcService service)
		{
			// Emitted by JavaRpcGenerator
			return null;
		}
	}

	private static MethodSpec assignMethod(ClassName className)
	{
		return MethodSpec.methodBuilder("assign")
				.addJavadoc("Points this accessor at the object at {@code position}.\n")
				.addModifiers(Modifier.PUBLIC)
				.returns(className)
				.addParameter(int.class, "position")
				.addParameter(BYTE_BUFFER, "buffer")
				.addStatement("init(position, buffer)")
				.addStatement("return this")
				.build();
	}

	static String constantIdentifier(String name)
	{
		return SourceVersion.isKeyword(name) ? name + "_" : name;
	}
}
