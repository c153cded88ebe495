package org.lokray.fbs.codegen;

/**
 * Settings shared by the Java backends.
 */
public class GeneratorOptions
{
	private String packagePrefix = "";
	private boolean generatedAnnotation = false;
	private String indent = "\t";

	public static GeneratorOptions defaults()
	{
		return new GeneratorOptions();
	}

	/**
	 * Package prepended to every schema namespace, e.g. {@code com.example} turns
	 * namespace {@code game} into package {@code com.example.game}.
	 */
	public String getPackagePrefix()
	{
		return packagePrefix;
	}

	public GeneratorOptions setPackagePrefix(String packagePrefix)
	{
		this.packagePrefix = packagePrefix == null ? "" : packagePrefix;
		return this;
	}

	/**
	 * Whether generated types carry {@code @javax.annotation.processing.Generated}.
	 */
	public boolean isGeneratedAnnotation()
	{
		return generatedAnnotation;
	}

	public GeneratorOptions setGeneratedAnnotation(boolean generatedAnnotation)
	{
		this.generatedAnnotation = generatedAnnotation;
		return this;
	}

	public String getIndent()
	{
		return indent;
	}

	public GeneratorOptions setIndent(String indent)
	{
		this.indent = indent;
		return this;
	}
}
