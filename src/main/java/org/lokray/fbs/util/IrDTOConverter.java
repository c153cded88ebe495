package org.lokray.fbs.util;

import org.lokray.fbs.dto.*;
import org.lokray.fbs.ir.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a {@link SchemaIr} into the plain DTOs written as IR JSON,
 * grouping declarations by namespace in first-seen order.
 */
public class IrDTOConverter
{
	public static SchemaDTO toSchema(SchemaIr ir)
	{
		SchemaDTO dto = new SchemaDTO();
		dto.source = ir.getSourceName();
		dto.rootType = ir.getRootType().map(IrDeclaration::getFullyQualifiedName).orElse(null);
		dto.fileIdentifier = ir.getFileIdentifier().orElse(null);
		dto.fileExtension = ir.getFileExtension();
		dto.attributes.addAll(ir.getDeclaredAttributes());

		Map<String, NamespaceDTO> namespaces = new LinkedHashMap<>();
		for (String name : ir.getNamespaces())
		{
			NamespaceDTO ns = new NamespaceDTO();
			ns.name = name;
			namespaces.put(name, ns);
		}

		for (IrDeclaration declaration : ir.getDeclarations())
		{
			NamespaceDTO ns = namespaces.computeIfAbsent(declaration.getNamespace(), name ->
			{
				NamespaceDTO created = new NamespaceDTO();
				created.name = name;
				return created;
			});
			declaration.accept(new IrDeclarationVisitor<Void>()
			{
				@Override
				public Void visitEnum(IrEnum irEnum)
				{
					ns.enums.add(enumToDTO(irEnum));
					return null;
				}

				@Override
				public Void visitUnion(IrUnion union)
				{
					ns.unions.add(unionToDTO(union));
					return null;
				}

				@Override
				public Void visitStruct(IrStruct struct)
				{
					ns.structs.add(structToDTO(struct));
					return null;
				}

				@Override
				public Void visitTable(IrTable table)
				{
					ns.tables.add(tableToDTO(table));
					return null;
				}

				@Override
				public Void visitRpcService(IrRpcService service)
				{
					ns.services.add(serviceToDTO(service));
					return null;
				}
			});
		}
		dto.namespaces.addAll(namespaces.values());
		return dto;
	}

	private static EnumDTO enumToDTO(IrEnum irEnum)
	{
		EnumDTO dto = new EnumDTO();
		dto.name = irEnum.getName();
		dto.underlyingType = irEnum.getUnderlyingType().getKeyword();
		dto.doc = docOf(irEnum.getDoc());
		for (IrEnumValue value : irEnum.getValues())
		{
			EnumValueDTO vd = new EnumValueDTO();
			vd.name = value.getName();
			vd.value = ScalarValue.ofLong(irEnum.getUnderlyingType(), value.getValue()).toSchemaString();
			dto.values.add(vd);
		}
		return dto;
	}

	private static UnionDTO unionToDTO(IrUnion union)
	{
		UnionDTO dto = new UnionDTO();
		dto.name = union.getName();
		dto.doc = docOf(union.getDoc());
		for (IrUnionVariant variant : union.getVariants())
		{
			UnionVariantDTO vd = new UnionVariantDTO();
			vd.name = variant.getName();
			vd.value = variant.getValue();
			vd.table = variant.getTable().getFullyQualifiedName();
			dto.variants.add(vd);
		}
		return dto;
	}

	private static StructDTO structToDTO(IrStruct struct)
	{
		StructDTO dto = new StructDTO();
		dto.name = struct.getName();
		dto.size = struct.getSize();
		dto.alignment = struct.getAlignment();
		dto.doc = docOf(struct.getDoc());
		for (IrStructField field : struct.getFields())
		{
			FieldDTO fd = new FieldDTO();
			fd.name = field.getName();
			fd.type = field.getType().getDisplayName();
			fd.offset = field.getOffset();
			fd.size = field.getSize();
			fd.padding = field.getPadding();
			dto.fields.add(fd);
		}
		return dto;
	}

	private static TableDTO tableToDTO(IrTable table)
	{
		TableDTO dto = new TableDTO();
		dto.name = table.getName();
		dto.slots = table.getSlotCount();
		dto.doc = docOf(table.getDoc());
		for (IrField field : table.getFields())
		{
			FieldDTO fd = new FieldDTO();
			fd.name = field.getName();
			fd.type = field.getType().getDisplayName();
			fd.slot = field.getSlot();
			fd.vtableOffset = field.getVtableOffset();
			fd.defaultValue = field.getDefaultValue() != null ? field.getDefaultValue().toSchemaString() : null;
			// Flags are written only when set
			fd.required = field.isRequired() ? Boolean.TRUE : null;
			fd.deprecated = field.isDeprecated() ? Boolean.TRUE : null;
			fd.key = field.isKey() ? Boolean.TRUE : null;
			fd.attributes = field.getAttributes().isEmpty() ? null : field.getAttributes();
			dto.fields.add(fd);
		}
		return dto;
	}

	private static RpcServiceDTO serviceToDTO(IrRpcService service)
	{
		RpcServiceDTO dto = new RpcServiceDTO();
		dto.name = service.getName();
		for (IrRpcMethod method : service.getMethods())
		{
			RpcMethodDTO md = new RpcMethodDTO();
			md.name = method.getName();
			md.request = method.getRequestType().getFullyQualifiedName();
			md.response = method.getResponseType().getFullyQualifiedName();
			md.streaming = method.getStreaming().getAttributeValue();
			dto.methods.add(md);
		}
		return dto;
	}

	private static List<String> docOf(List<String> doc)
	{
		return doc.isEmpty() ? null : doc;
	}
}
