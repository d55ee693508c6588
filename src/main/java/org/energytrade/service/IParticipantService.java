package org.energytrade.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.energytrade.domain.Participant;

public interface IParticipantService extends IService<Participant> {

    /**
     * @throws org.energytrade.exception.ValidationException 参与方不存在
     */
    Participant getRequired(String participantId);

    /**
     * 卖方关联的参与方，没有则返回null
     */
    Participant findByProviderId(String providerId);

    /**
     * 新增或更新参与方，新参与方使用默认信任分
     */
    Participant register(Participant participant);
}
