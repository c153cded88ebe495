package org.lokray.fbs.dto;

import java.util.ArrayList;
import java.util.List;

public class RpcServiceDTO
{
	public String name;
	public List<RpcMethodDTO> methods = new ArrayList<>();
}
