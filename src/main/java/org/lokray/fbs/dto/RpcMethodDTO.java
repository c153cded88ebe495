package org.lokray.fbs.dto;

public class RpcMethodDTO
{
	public String name;
	public String request;
	public String response;
	public String streaming;
}
