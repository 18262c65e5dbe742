package com.jeffdisher.aeon.net;

import java.nio.ByteBuffer;
import java.util.List;

import com.jeffdisher.aeon.wire.Codecs;
import com.jeffdisher.aeon.wire.ICodec;


/**
 * Describes the server to a client which has been accepted.  quickPort is where the client sends its datagrams and
 * the mod list lets the client check that it has the matching client mods loaded.
 */
public record ServerInfo(String serverName, String serverVersion, String modProfile, int quickPort, List<String> mods)
{
	private static final ICodec<List<String>> MOD_LIST = Codecs.listOf(Codecs.STRING);
	public static final ICodec<ServerInfo> CODEC = Codecs.of((ByteBuffer buffer) -> {
		String serverName = Codecs.STRING.read(buffer);
		String serverVersion = Codecs.STRING.read(buffer);
		String modProfile = Codecs.STRING.read(buffer);
		int quickPort = Short.toUnsignedInt(Codecs.SHORT.read(buffer));
		List<String> mods = MOD_LIST.read(buffer);
		return new ServerInfo(serverName, serverVersion, modProfile, quickPort, mods);
	}, (ByteBuffer buffer, ServerInfo value) -> {
		Codecs.STRING.write(buffer, value.serverName);
		Codecs.STRING.write(buffer, value.serverVersion);
		Codecs.STRING.write(buffer, value.modProfile);
		Codecs.SHORT.write(buffer, (short) value.quickPort);
		MOD_LIST.write(buffer, value.mods);
	});
}
