package com.jeffdisher.aeon.integration.chat;

import java.nio.ByteBuffer;

import com.jeffdisher.aeon.messaging.HandleType;
import com.jeffdisher.aeon.messaging.RemoteFunction;
import com.jeffdisher.aeon.wire.Codecs;
import com.jeffdisher.aeon.wire.ICodec;
import com.jeffdisher.aeon.wire.UnionCodec;


/**
 * The names shared by both halves of the chat mod.
 */
public class ChatProtocol
{
	public static final String MOD_NAME = "chat";
	/**
	 * The tag of the single chat room entity.
	 */
	public static final String ROOM_TAG = "chat.room";
	public static final HandleType ROOM = HandleType.declare("chat.room");
	/**
	 * Client to server:  a line typed by the user.
	 */
	public static final RemoteFunction<String> SAY = RemoteFunction.declare("chat.room.say", Codecs.STRING);
	/**
	 * Server to client:  something to show in the chat log.
	 */
	public static final RemoteFunction<IChatEvent> SHOW = RemoteFunction.declare("chat.room.show", _eventCodec());
	/**
	 * The command which lists who is in the room (answered only to the sender).
	 */
	public static final String WHO_COMMAND = "/who";

	private ChatProtocol()
	{
	}


	/**
	 * Something shown in a client's chat log.
	 */
	public static interface IChatEvent
	{
		/**
		 * @return The text as shown to the user.
		 */
		String format();
	}

	public static record Line(String sender, String text) implements IChatEvent
	{
		@Override
		public String format()
		{
			return "<" + this.sender + "> " + this.text;
		}
	}

	public static record Notice(String text) implements IChatEvent
	{
		@Override
		public String format()
		{
			return "* " + this.text;
		}
	}


	private static ICodec<IChatEvent> _eventCodec()
	{
		ICodec<Line> line = Codecs.of((ByteBuffer buffer) -> {
			String sender = Codecs.STRING.read(buffer);
			String text = Codecs.STRING.read(buffer);
			return new Line(sender, text);
		}, (ByteBuffer buffer, Line value) -> {
			Codecs.STRING.write(buffer, value.sender);
			Codecs.STRING.write(buffer, value.text);
		});
		ICodec<Notice> notice = Codecs.of((ByteBuffer buffer) -> new Notice(Codecs.STRING.read(buffer))
				, (ByteBuffer buffer, Notice value) -> Codecs.STRING.write(buffer, value.text)
		);
		return UnionCodec.builder(IChatEvent.class)
				.variant(Line.class, line)
				.variant(Notice.class, notice)
				.build()
		;
	}
}
