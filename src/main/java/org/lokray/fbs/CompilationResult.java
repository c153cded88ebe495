package org.lokray.fbs;

import org.lokray.fbs.codegen.GeneratedFile;
import org.lokray.fbs.ir.SchemaIr;

import java.util.List;

public final class CompilationResult
{
	private final SchemaIr ir;
	private final List<GeneratedFile> files;

	public CompilationResult(SchemaIr ir, List<GeneratedFile> files)
	{
		this.ir = ir;
		this.files = List.copyOf(files);
	}

	public SchemaIr getIr()
	{
		return ir;
	}

	public List<GeneratedFile> getFiles()
	{
		return files;
	}
}
