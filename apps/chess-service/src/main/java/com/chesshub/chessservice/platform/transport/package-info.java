/**
 * 通信协议适配层：下行事件外壳与推送出口。
 * 只定义“服务器和客户端之间交换的消息结构”，不关心落子、胜负等业务逻辑。
 */
package com.chesshub.chessservice.platform.transport;
