package org.lokray.fbs.dto;

import java.util.ArrayList;
import java.util.List;

public class NamespaceDTO
{
	public String name;
	public List<EnumDTO> enums = new ArrayList<>();
	public List<UnionDTO> unions = new ArrayList<>();
	public List<StructDTO> structs = new ArrayList<>();
	public List<TableDTO> tables = new ArrayList<>();
	public List<RpcServiceDTO> services = new ArrayList<>();
}
