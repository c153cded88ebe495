package org.lokray.fbs.codegen;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.fbs.ir.SchemaIr;
import org.lokray.fbs.util.IrDTOConverter;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes the resolved schema as {@code <file>.ir.json} for tooling that
 * wants layouts and slots without parsing schemas itself.
 */
public class IrJsonGenerator implements CodeGenerator
{
	public static final String EXTENSION = ".ir.json";

	private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

	@Override
	public String getName()
	{
		return "ir-json";
	}

	@Override
	public List<GeneratedFile> generate(SchemaIr ir)
	{
		String json = gson.toJson(IrDTOConverter.toSchema(ir));
		return List.of(new GeneratedFile(baseNameOf(ir.getSourceName()) + EXTENSION, json + System.lineSeparator()));
	}

	static String baseNameOf(String sourceName)
	{
		Path fileName = Path.of(sourceName).getFileName();
		String name = fileName == null ? sourceName : fileName.toString();
		return name.endsWith(".fbs") ? name.substring(0, name.length() - ".fbs".length()) : name;
	}
}
