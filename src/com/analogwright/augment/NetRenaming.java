/*
 * Copyright (c) 2026, AnalogWright contributors.
 * All rights reserved.
 *
 * This file is part of AnalogWright.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package com.analogwright.augment;

import com.analogwright.vocab.NetCategory;

/**
 * Which nets the {@link RenamingAugmentor} relabels. Singleton nets (VDD, VSS) are never renamed.
 */
public enum NetRenaming {
    /** Rename internal nets and numbered ports; a bare port (VOUT) keeps its name */
    ALL_INDEXED,
    /** Rename internal nets only, keep port names */
    INTERNAL_ONLY,
    /** Keep all net names, rename devices only */
    NONE;

    public boolean renames(NetCategory category) {
        if (category.isSingleton()) return false;
        switch (this) {
            case ALL_INDEXED:
                return true;
            case INTERNAL_ONLY:
                return category.isInternal();
            default:
                return false;
        }
    }
}
