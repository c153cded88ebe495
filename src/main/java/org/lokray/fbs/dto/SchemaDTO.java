package org.lokray.fbs.dto;

import java.util.ArrayList;
import java.util.List;

public class SchemaDTO
{
	public String source;
	public String rootType;
	public String fileIdentifier;
	public String fileExtension;
	public List<String> attributes = new ArrayList<>();
	public List<NamespaceDTO> namespaces = new ArrayList<>();
}
